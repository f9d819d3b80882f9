package org.cspii.intranet.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Naming rules for derived teams and franchise labels.
 * Centralizes the rules so the derivation engine and the directory gateways agree on them.
 */
public final class TeamNameUtils {

    private static final String MACHINE_NAME_SEPARATOR = "-";
    private static final String DISPLAY_NAME_SEPARATOR = " ";

    private static final Set<String> ISO_COUNTRIES = Arrays.stream(Locale.getISOCountries())
            .collect(Collectors.toUnmodifiableSet());

    private TeamNameUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Machine name of the team owned by the given franchise and division, franchise first.
     * {@code machineName("east", "ops")} is {@code "east-ops"}.
     */
    public static String machineName(String franchiseMachineName, String divisionMachineName) {
        return franchiseMachineName + MACHINE_NAME_SEPARATOR + divisionMachineName;
    }

    public static String displayName(String franchiseDisplayName, String divisionDisplayName) {
        return franchiseDisplayName + DISPLAY_NAME_SEPARATOR + divisionDisplayName;
    }

    /**
     * Label a franchise gets when it is created. Franchises named after an ISO-3166
     * country code get the English country name, anything else keeps its machine name.
     */
    public static String franchiseLabel(String franchiseMachineName) {
        if (franchiseMachineName == null) {
            return null;
        }
        String code = franchiseMachineName.toUpperCase(Locale.ROOT);
        if (!ISO_COUNTRIES.contains(code)) {
            return franchiseMachineName;
        }
        return new Locale("", code).getDisplayCountry(Locale.ENGLISH);
    }
}
