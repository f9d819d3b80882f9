package org.cspii.intranet.model.domain;

import java.util.Objects;

/**
 * Points at a directory group a user can be made a member of.
 */
public record GroupRef(GroupKind kind, String machineName) {

    public GroupRef {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(machineName, "machineName");
    }

    public static GroupRef team(String machineName) {
        return new GroupRef(GroupKind.TEAM, machineName);
    }

    public static GroupRef franchise(String machineName) {
        return new GroupRef(GroupKind.FRANCHISE, machineName);
    }

    public static GroupRef division(String machineName) {
        return new GroupRef(GroupKind.DIVISION, machineName);
    }
}
