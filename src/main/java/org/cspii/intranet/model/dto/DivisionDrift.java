package org.cspii.intranet.model.dto;

/**
 * Where a division is declared: in the local configuration, in the directory, or both.
 * A display name is null when the division is absent from that source.
 */
public record DivisionDrift(
        String machineName,
        boolean existsInConfig,
        boolean existsInDirectory,
        String configDisplayName,
        String directoryDisplayName
) {

    public boolean isConsistent() {
        return existsInConfig && existsInDirectory;
    }

    public boolean hasDisplayNameMismatch() {
        return isConsistent() && configDisplayName != null
                && !configDisplayName.equals(directoryDisplayName);
    }
}
