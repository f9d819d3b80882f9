package org.cspii.intranet.model.domain;

/**
 * Group folder permission levels, as the groupware encodes them.
 */
public enum FolderPermission {
    READ(1),
    UPDATE(2),
    CREATE(4),
    DELETE(8),
    SHARE(16),
    ALL(31);

    private final int value;

    FolderPermission(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }
}
