package org.cspii.intranet.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cspii.intranet.client.DirectoryGateway;
import org.cspii.intranet.client.exception.GatewayException;
import org.cspii.intranet.model.domain.Division;
import org.cspii.intranet.model.domain.Franchise;
import org.cspii.intranet.model.dto.OperationOutcome;
import org.cspii.intranet.service.derivation.TeamDerivationEngine;
import org.cspii.intranet.service.folder.FolderProvisioner;
import org.springframework.stereotype.Service;

/**
 * Entry point for creating franchises and divisions. Creates the entry, then the
 * derived teams, then (for franchises) the group folder.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HierarchyService {

    private final DirectoryGateway directoryGateway;
    private final TeamDerivationEngine teamDerivationEngine;
    private final FolderProvisioner folderProvisioner;

    public OperationOutcome createFranchise(String machineName) {
        log.info("Creating franchise '{}'", machineName);
        Franchise franchise;
        try {
            franchise = directoryGateway.createFranchise(machineName);
        } catch (GatewayException e) {
            // An existing franchise is a conflict here, not an idempotent success
            log.warn("Could not create franchise '{}': {}", machineName, e.getMessage());
            return OperationOutcome.failed(e.getKind(), "Could not create franchise " + machineName + ": " + e.getMessage());
        }

        OperationOutcome teams = teamDerivationEngine.ensureTeamsForNewFranchise(franchise);
        OperationOutcome folder = folderProvisioner.createFranchiseFolder(franchise.getMachineName());
        return teams.and(folder);
    }

    public OperationOutcome createDivision(String machineName, String displayName) {
        log.info("Creating division '{}' ({})", machineName, displayName);
        Division division;
        try {
            division = directoryGateway.createDivision(machineName, displayName);
        } catch (GatewayException e) {
            log.warn("Could not create division '{}': {}", machineName, e.getMessage());
            return OperationOutcome.failed(e.getKind(), "Could not create division " + machineName + ": " + e.getMessage());
        }
        return teamDerivationEngine.ensureTeamsForNewDivision(division);
    }
}
