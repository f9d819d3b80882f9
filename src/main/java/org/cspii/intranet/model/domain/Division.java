package org.cspii.intranet.model.domain;

import lombok.Getter;
import lombok.Setter;

import java.util.Objects;

/**
 * A functional area of the organisation. Divisions are crossed with franchises
 * to produce teams, so the machine name never changes once created.
 */
@Getter
public class Division {

    private final String machineName;

    @Setter
    private String displayName;

    @Setter
    private String distinguishedName;

    public Division(String machineName, String displayName) {
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
        Division that = (Division) o;
        return machineName.equals(that.machineName);
    }

    @Override
    public int hashCode() {
        return machineName.hashCode();
    }

    @Override
    public String toString() {
        return "Division{" +
                "machineName='" + machineName + '\'' +
                ", displayName='" + displayName + '\'' +
                '}';
    }
}
