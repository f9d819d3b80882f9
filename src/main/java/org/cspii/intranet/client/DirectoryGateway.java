package org.cspii.intranet.client;

import org.cspii.intranet.model.domain.Division;
import org.cspii.intranet.model.domain.Franchise;
import org.cspii.intranet.model.domain.GroupRef;
import org.cspii.intranet.model.domain.Team;
import org.cspii.intranet.model.domain.TeamPair;
import org.cspii.intranet.model.domain.User;

import java.util.List;
import java.util.Optional;

/**
 * Operations against the directory service.
 * Allows swapping between the in-memory and the LDAP implementation.
 *
 * <p>Failures are reported with the unchecked exceptions of
 * {@code org.cspii.intranet.client.exception}.
 */
public interface DirectoryGateway {

    User createUser(String uid, String givenName, String surname, String password);

    /**
     * @throws org.cspii.intranet.client.exception.ObjectNotFoundException if no such user
     */
    User getUser(String uid);

    void deleteUser(String uid);

    Division createDivision(String machineName, String displayName);

    /**
     * Creates the franchise; the directory assigns the display label.
     */
    Franchise createFranchise(String machineName);

    List<Division> getDivisions();

    List<Franchise> getFranchises();

    /**
     * @throws org.cspii.intranet.client.exception.ObjectNotFoundException if no such team
     */
    Team getTeam(String machineName);

    Team createTeam(String machineName, String displayName);

    /**
     * @throws org.cspii.intranet.client.exception.ObjectAlreadyExistsException if the user is already a member
     */
    void addMembership(String uid, GroupRef group);

    /**
     * The franchise and division a derived team belongs to; empty for the
     * distinguished teams and any team not produced by the cross product.
     */
    Optional<TeamPair> getTeamOwningPair(String teamMachineName);

    List<Team> getTeamsOfUser(String uid);
}
