package org.cspii.intranet.service.derivation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cspii.intranet.client.DirectoryGateway;
import org.cspii.intranet.client.exception.ObjectAlreadyExistsException;
import org.cspii.intranet.client.exception.ObjectNotFoundException;
import org.cspii.intranet.client.exception.GatewayException;
import org.cspii.intranet.model.domain.Division;
import org.cspii.intranet.model.domain.Franchise;
import org.cspii.intranet.model.dto.ErrorKind;
import org.cspii.intranet.model.dto.ItemResult;
import org.cspii.intranet.model.dto.OperationOutcome;
import org.cspii.intranet.util.TeamNameUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps a team in the directory for every franchise/division pair.
 *
 * <p>Each derivation is a batch: one item per pair. A pair whose team exists is
 * skipped, a pair the directory refuses is logged and reported as failed, and the
 * batch always runs to the end. Running a derivation again converges on the same
 * set of teams.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TeamDerivationEngine {

    private final DirectoryGateway directoryGateway;

    /**
     * Create the teams pairing a newly created franchise with every existing division.
     */
    public OperationOutcome ensureTeamsForNewFranchise(Franchise franchise) {
        log.info("Deriving teams for franchise '{}'", franchise.getMachineName());

        List<Division> divisions;
        try {
            divisions = directoryGateway.getDivisions();
        } catch (GatewayException e) {
            log.error("Could not list divisions for franchise '{}'", franchise.getMachineName(), e);
            return OperationOutcome.failed(e.getKind(), "Could not list divisions: " + e.getMessage());
        }

        List<ItemResult> items = new ArrayList<>();
        for (Division division : divisions) {
            items.add(ensureTeam(franchise, division));
        }
        return summarise("Derive teams for franchise " + franchise.getMachineName(), items);
    }

    /**
     * Create the teams pairing every existing franchise with a newly created division.
     */
    public OperationOutcome ensureTeamsForNewDivision(Division division) {
        log.info("Deriving teams for division '{}'", division.getMachineName());

        List<Franchise> franchises;
        try {
            franchises = directoryGateway.getFranchises();
        } catch (GatewayException e) {
            log.error("Could not list franchises for division '{}'", division.getMachineName(), e);
            return OperationOutcome.failed(e.getKind(), "Could not list franchises: " + e.getMessage());
        }

        List<ItemResult> items = new ArrayList<>();
        for (Franchise franchise : franchises) {
            items.add(ensureTeam(franchise, division));
        }
        return summarise("Derive teams for division " + division.getMachineName(), items);
    }

    /**
     * Walk the whole franchise x division product and create whatever is missing.
     * Repairs gaps left by derivations that failed part-way.
     */
    public OperationOutcome ensureAllTeams() {
        log.info("Deriving teams for the full franchise x division product");

        List<Franchise> franchises;
        List<Division> divisions;
        try {
            franchises = directoryGateway.getFranchises();
            divisions = directoryGateway.getDivisions();
        } catch (GatewayException e) {
            log.error("Could not list franchises and divisions", e);
            return OperationOutcome.failed(e.getKind(), "Could not list hierarchy: " + e.getMessage());
        }

        List<ItemResult> items = new ArrayList<>();
        for (Franchise franchise : franchises) {
            for (Division division : divisions) {
                items.add(ensureTeam(franchise, division));
            }
        }
        return summarise("Derive all teams", items);
    }

    private ItemResult ensureTeam(Franchise franchise, Division division) {
        String machineName = TeamNameUtils.machineName(franchise.getMachineName(), division.getMachineName());
        String displayName = TeamNameUtils.displayName(
                labelOf(franchise.getDisplayName(), franchise.getMachineName()),
                labelOf(division.getDisplayName(), division.getMachineName()));

        try {
            if (teamExists(machineName)) {
                log.debug("Team '{}' already exists, skipping", machineName);
                return ItemResult.skipped(machineName, ErrorKind.ALREADY_EXISTS, "Team already exists");
            }
            directoryGateway.createTeam(machineName, displayName);
            log.info("Created team '{}' ({})", machineName, displayName);
            return ItemResult.created(machineName);
        } catch (ObjectAlreadyExistsException e) {
            log.info("Team '{}' was created concurrently, skipping", machineName);
            return ItemResult.skipped(machineName, ErrorKind.ALREADY_EXISTS, e.getMessage());
        } catch (GatewayException e) {
            log.error("Failed to create team '{}', continuing with the remaining pairs", machineName, e);
            return ItemResult.failed(machineName, e.getKind(), e.getMessage());
        }
    }

    private boolean teamExists(String machineName) {
        try {
            directoryGateway.getTeam(machineName);
            return true;
        } catch (ObjectNotFoundException e) {
            return false;
        }
    }

    private static String labelOf(String displayName, String machineName) {
        return displayName != null ? displayName : machineName;
    }

    private static OperationOutcome summarise(String operation, List<ItemResult> items) {
        OperationOutcome outcome = OperationOutcome.fromItems(operation, items);
        if (outcome.isSuccess()) {
            log.info(outcome.message());
        } else {
            log.warn(outcome.message());
        }
        return outcome;
    }
}
