package org.cspii.intranet.service.reconciliation;

import lombok.extern.slf4j.Slf4j;
import org.cspii.intranet.client.DirectoryGateway;
import org.cspii.intranet.client.exception.ObjectNotFoundException;
import org.cspii.intranet.model.domain.Division;
import org.cspii.intranet.model.dto.DivisionDrift;
import org.cspii.intranet.service.SingletonTeamService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Compares the configured divisions with the directory and reports drift.
 *
 * Read-only: nothing found missing is created here.
 */
@Slf4j
@Service
public class ConsistencyReconciler {

    private final DirectoryGateway directoryGateway;
    private final ConfigDivisionSource configDivisionSource;
    private final String topLevelTeam;

    public ConsistencyReconciler(DirectoryGateway directoryGateway,
                                 ConfigDivisionSource configDivisionSource,
                                 @Value("${app.hierarchy.top-level-team:international}") String topLevelTeam) {
        this.directoryGateway = directoryGateway;
        this.configDivisionSource = configDivisionSource;
        this.topLevelTeam = topLevelTeam;
    }

    /**
     * Merge both division sources into one entry per machine name, ordered by machine name.
     *
     * @param configDivisions    machine name to display name, from configuration
     * @param directoryDivisions divisions read from the directory
     */
    public SortedMap<String, DivisionDrift> reconcile(Map<String, String> configDivisions,
                                                      List<Division> directoryDivisions) {
        SortedMap<String, DivisionDrift> merged = new TreeMap<>();

        configDivisions.forEach((machineName, displayName) ->
                merged.put(machineName, new DivisionDrift(machineName, true, false, displayName, null)));

        for (Division division : directoryDivisions) {
            String machineName = division.getMachineName();
            DivisionDrift configured = merged.get(machineName);
            if (configured != null) {
                merged.put(machineName, new DivisionDrift(machineName, true, true,
                        configured.configDisplayName(), division.getDisplayName()));
            } else {
                merged.put(machineName, new DivisionDrift(machineName, false, true,
                        null, division.getDisplayName()));
            }
        }
        return Collections.unmodifiableSortedMap(merged);
    }

    /**
     * Load the configuration once, read the directory, and log every division
     * that is declared in only one of them or labelled differently.
     *
     * @return the full merged view, drifted entries included
     * @throws org.cspii.intranet.client.exception.GatewayException if the directory cannot be read
     */
    public SortedMap<String, DivisionDrift> reportDrift() {
        Map<String, String> configured = configDivisionSource.loadDivisions();
        List<Division> inDirectory = directoryGateway.getDivisions();

        SortedMap<String, DivisionDrift> divisions = reconcile(configured, inDirectory);
        int drifted = 0;
        for (DivisionDrift drift : divisions.values()) {
            if (!drift.isConsistent() || drift.hasDisplayNameMismatch()) {
                logDrift(drift);
                drifted++;
            }
        }
        log.info("Division consistency check: {} divisions, {} drifted", divisions.size(), drifted);
        return divisions;
    }

    private void logDrift(DivisionDrift drift) {
        if (!drift.existsInDirectory()) {
            log.warn("[DRIFT] Division '{}' is configured but missing in the directory", drift.machineName());
        } else if (!drift.existsInConfig()) {
            log.warn("[DRIFT] Division '{}' exists in the directory but is not configured", drift.machineName());
        } else {
            log.warn("[DRIFT] Division '{}' is labelled '{}' in configuration but '{}' in the directory",
                    drift.machineName(), drift.configDisplayName(), drift.directoryDisplayName());
        }
    }

    /**
     * Check that the "everybody" team and the top-level team exist. Missing ones are
     * logged as warnings; the system keeps running without them.
     *
     * @return machine names of the missing teams, empty when both exist
     */
    public List<String> checkRequiredSingletons() {
        List<String> missing = new ArrayList<>();
        for (String team : List.of(SingletonTeamService.EVERYBODY_MACHINE_NAME, topLevelTeam)) {
            try {
                directoryGateway.getTeam(team);
            } catch (ObjectNotFoundException e) {
                log.warn("Required team '{}' is missing in the directory", team);
                missing.add(team);
            }
        }
        return missing;
    }
}
