package org.cspii.intranet.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cspii.intranet.client.DirectoryGateway;
import org.cspii.intranet.client.exception.ObjectAlreadyExistsException;
import org.cspii.intranet.client.exception.ObjectNotFoundException;
import org.cspii.intranet.model.domain.Team;
import org.springframework.stereotype.Service;

/**
 * Creates the distinguished teams that are not derived from a franchise/division pair.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SingletonTeamService {

    public static final String EVERYBODY_MACHINE_NAME = "everybody";
    public static final String EVERYBODY_DISPLAY_NAME = "Everybody";

    private final DirectoryGateway directoryGateway;

    public Team ensureEverybodyTeam() {
        return ensureSingleton(EVERYBODY_MACHINE_NAME, EVERYBODY_DISPLAY_NAME);
    }

    /**
     * Fetch the team, creating it first if it is missing. Safe to race: when a
     * concurrent caller creates the team in between, its AlreadyExists is ignored
     * and both callers end up re-fetching the same entry.
     *
     * @throws org.cspii.intranet.client.exception.GatewayException if the directory cannot be reached
     */
    public Team ensureSingleton(String machineName, String displayName) {
        try {
            return directoryGateway.getTeam(machineName);
        } catch (ObjectNotFoundException e) {
            log.info("Team '{}' is missing, creating it", machineName);
        }

        try {
            directoryGateway.createTeam(machineName, displayName);
        } catch (ObjectAlreadyExistsException e) {
            log.info("Team '{}' was created concurrently, re-fetching", machineName);
        }
        return directoryGateway.getTeam(machineName);
    }
}
