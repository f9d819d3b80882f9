package org.cspii.intranet.service.reconciliation;

import java.util.Map;

/**
 * The locally configured, canonical list of divisions.
 */
public interface ConfigDivisionSource {

    /**
     * @return division machine name to display name; read afresh on every call
     */
    Map<String, String> loadDivisions();
}
