package org.cspii.intranet.model.domain;

import lombok.Getter;
import lombok.Setter;

import java.util.Objects;

/**
 * A regional unit of the organisation, usually named after a country code.
 */
@Getter
public class Franchise {

    private final String machineName;

    @Setter
    private String displayName;

    @Setter
    private String distinguishedName;

    public Franchise(String machineName, String displayName) {
        this.machineName = Objects.requireNonNull(machineName, "machineName");
        this.displayName = displayName;
    }

    public boolean isMaterialized() {
        return distinguishedName != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Franchise that = (Franchise) o;
        return machineName.equals(that.machineName);
    }

    @Override
    public int hashCode() {
        return machineName.hashCode();
    }

    @Override
    public String toString() {
        return "Franchise{" +
                "machineName='" + machineName + '\'' +
                ", displayName='" + displayName + '\'' +
                '}';
    }
}
