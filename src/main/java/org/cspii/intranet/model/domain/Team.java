package org.cspii.intranet.model.domain;

import lombok.Getter;
import lombok.Setter;

import java.util.Objects;

/**
 * A directory group. Every team except the distinguished ones is derived from
 * exactly one franchise/division pair, see {@link org.cspii.intranet.util.TeamNameUtils}.
 */
@Getter
public class Team {

    private final String machineName;

    @Setter
    private String displayName;

    @Setter
    private String distinguishedName;

    public Team(String machineName, String displayName) {
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
        Team that = (Team) o;
        return machineName.equals(that.machineName);
    }

    @Override
    public int hashCode() {
        return machineName.hashCode();
    }

    @Override
    public String toString() {
        return "Team{" +
                "machineName='" + machineName + '\'' +
                ", displayName='" + displayName + '\'' +
                '}';
    }
}
