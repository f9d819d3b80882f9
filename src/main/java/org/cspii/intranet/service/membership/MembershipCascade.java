package org.cspii.intranet.service.membership;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cspii.intranet.client.DirectoryGateway;
import org.cspii.intranet.client.exception.ObjectAlreadyExistsException;
import org.cspii.intranet.client.exception.GatewayException;
import org.cspii.intranet.model.domain.GroupRef;
import org.cspii.intranet.model.domain.Team;
import org.cspii.intranet.model.domain.TeamPair;
import org.cspii.intranet.model.domain.User;
import org.cspii.intranet.model.dto.ErrorKind;
import org.cspii.intranet.model.dto.ItemResult;
import org.cspii.intranet.model.dto.OperationOutcome;
import org.cspii.intranet.service.SingletonTeamService;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Applies team membership together with the franchise, division and
 * "everybody" memberships it implies.
 *
 * <p>Franchise and division membership are never assigned on their own: they
 * always follow from joining a team. A membership the directory already holds
 * counts as applied, so every operation here can be re-run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MembershipCascade {

    private final DirectoryGateway directoryGateway;
    private final SingletonTeamService singletonTeamService;

    /**
     * Create the user, join the requested teams, then join "everybody".
     *
     * <p>The user entry is written before any membership. "Everybody" is joined last,
     * so a provisioning cut short by an unreachable directory leaves a user that is
     * present but missing from "everybody". A team that cannot be joined for any
     * other reason is reported and does not stop provisioning. A null team list
     * provisions the user into "everybody" only.
     */
    public OperationOutcome provisionNewUser(User user, String password, Collection<String> initialTeams) {
        String uid = user.getUid();
        Collection<String> teams = initialTeams != null ? initialTeams : List.of();
        log.info("Provisioning user '{}' with initial teams {}", uid, teams);

        try {
            directoryGateway.createUser(uid, user.getGivenName(), user.getSurname(), password);
        } catch (GatewayException e) {
            log.error("Could not create user '{}'", uid, e);
            return OperationOutcome.failed(e.getKind(), "Could not create user " + uid + ": " + e.getMessage());
        }

        List<ItemResult> items = new ArrayList<>();
        for (String team : teams) {
            OperationOutcome joined = addUserToTeam(uid, team);
            if (joined.isSuccess()) {
                items.add(ItemResult.applied(team));
                continue;
            }
            items.add(ItemResult.failed(team, joined.errorKind(), joined.message()));
            if (joined.errorKind() == ErrorKind.GATEWAY_UNAVAILABLE) {
                log.error("Directory unavailable while provisioning '{}'; user is not in '{}'",
                        uid, SingletonTeamService.EVERYBODY_MACHINE_NAME);
                return OperationOutcome.failed(ErrorKind.GATEWAY_UNAVAILABLE,
                        "Provisioning of " + uid + " stopped: " + joined.message(), items);
            }
        }

        try {
            Team everybody = singletonTeamService.ensureEverybodyTeam();
            items.add(join(uid, GroupRef.team(everybody.getMachineName())));
        } catch (GatewayException e) {
            log.error("Could not add '{}' to '{}'", uid, SingletonTeamService.EVERYBODY_MACHINE_NAME, e);
            items.add(ItemResult.failed(SingletonTeamService.EVERYBODY_MACHINE_NAME, e.getKind(), e.getMessage()));
        }

        OperationOutcome outcome = OperationOutcome.fromItems("Provision user " + uid, items);
        log.info(outcome.message());
        return outcome;
    }

    /**
     * Join a team and, for a derived team, its franchise and division, in that order.
     * A team without an owning pair is joined on its own.
     */
    public OperationOutcome addUserToTeam(String uid, String teamMachineName) {
        try {
            directoryGateway.getTeam(teamMachineName);
        } catch (GatewayException e) {
            log.warn("Cannot add '{}' to team '{}': {}", uid, teamMachineName, e.getMessage());
            return OperationOutcome.failed(e.getKind(), "Team " + teamMachineName + ": " + e.getMessage());
        }

        List<ItemResult> items = new ArrayList<>();
        try {
            Optional<TeamPair> pair = directoryGateway.getTeamOwningPair(teamMachineName);

            items.add(join(uid, GroupRef.team(teamMachineName)));
            if (pair.isPresent()) {
                items.add(join(uid, GroupRef.franchise(pair.get().franchiseId())));
                items.add(join(uid, GroupRef.division(pair.get().divisionId())));
            } else {
                log.debug("Team '{}' has no owning franchise/division, joined the team only", teamMachineName);
            }
        } catch (GatewayException e) {
            log.error("Failed to cascade membership of '{}' in team '{}'", uid, teamMachineName, e);
            return OperationOutcome.failed(e.getKind(),
                    "Membership of " + uid + " in " + teamMachineName + " incomplete: " + e.getMessage(), items);
        }

        log.info("Added '{}' to team '{}' ({} memberships)", uid, teamMachineName, items.size());
        return OperationOutcome.fromItems("Add " + uid + " to " + teamMachineName, items);
    }

    /**
     * Teams the user is a direct member of.
     *
     * @throws GatewayException if the directory cannot answer
     */
    public List<Team> getTeamsOfUser(String uid) {
        return directoryGateway.getTeamsOfUser(uid);
    }

    public OperationOutcome removeUser(String uid) {
        try {
            directoryGateway.deleteUser(uid);
        } catch (GatewayException e) {
            log.warn("Could not delete user '{}': {}", uid, e.getMessage());
            return OperationOutcome.failed(e.getKind(), "Could not delete user " + uid + ": " + e.getMessage());
        }
        log.info("Deleted user '{}'", uid);
        return OperationOutcome.succeeded("Deleted user " + uid);
    }

    private ItemResult join(String uid, GroupRef group) {
        try {
            directoryGateway.addMembership(uid, group);
            return ItemResult.applied(group.machineName());
        } catch (ObjectAlreadyExistsException e) {
            log.debug("'{}' is already a member of {}", uid, group);
            return ItemResult.skipped(group.machineName(), ErrorKind.ALREADY_EXISTS, "Already a member");
        }
    }
}
