package org.cspii.intranet.client.impl;

import lombok.extern.slf4j.Slf4j;
import org.cspii.intranet.client.DirectoryGateway;
import org.cspii.intranet.client.exception.ObjectAlreadyExistsException;
import org.cspii.intranet.client.exception.ObjectNotFoundException;
import org.cspii.intranet.model.domain.Division;
import org.cspii.intranet.model.domain.Franchise;
import org.cspii.intranet.model.domain.GroupKind;
import org.cspii.intranet.model.domain.GroupRef;
import org.cspii.intranet.model.domain.Team;
import org.cspii.intranet.model.domain.TeamPair;
import org.cspii.intranet.model.domain.User;
import org.cspii.intranet.util.TeamNameUtils;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directory kept in memory, used by the test profile and by unit tests.
 * Reports the same failures the LDAP gateway does.
 */
@Slf4j
@Service
@Profile("test")
public class MockDirectoryGateway implements DirectoryGateway {

    private final Map<String, User> users = new LinkedHashMap<>();
    private final Map<String, Division> divisions = new LinkedHashMap<>();
    private final Map<String, Franchise> franchises = new LinkedHashMap<>();
    private final Map<String, Team> teams = new LinkedHashMap<>();
    private final Map<GroupRef, Set<String>> members = new LinkedHashMap<>();

    @Override
    public synchronized User createUser(String uid, String givenName, String surname, String password) {
        if (users.containsKey(uid)) {
            throw new ObjectAlreadyExistsException("User already exists: " + uid);
        }
        User user = new User(uid, givenName, surname);
        user.setDistinguishedName("uid=" + uid + ",ou=people");
        users.put(uid, user);
        log.info("MOCK DIRECTORY - Created user {}", uid);
        return user;
    }

    @Override
    public synchronized User getUser(String uid) {
        User stored = users.get(uid);
        if (stored == null) {
            throw new ObjectNotFoundException("User not found: " + uid);
        }
        User user = new User(uid, stored.getGivenName(), stored.getSurname());
        user.setMail(stored.getMail());
        user.setDistinguishedName(stored.getDistinguishedName());
        getTeamsOfUser(uid).forEach(team -> user.getTeams().add(team.getMachineName()));
        return user;
    }

    @Override
    public synchronized void deleteUser(String uid) {
        if (users.remove(uid) == null) {
            throw new ObjectNotFoundException("User not found: " + uid);
        }
        members.values().forEach(uids -> uids.remove(uid));
        log.info("MOCK DIRECTORY - Deleted user {}", uid);
    }

    @Override
    public synchronized Division createDivision(String machineName, String displayName) {
        if (divisions.containsKey(machineName)) {
            throw new ObjectAlreadyExistsException("Division already exists: " + machineName);
        }
        Division division = new Division(machineName, displayName);
        division.setDistinguishedName("cn=" + machineName + ",ou=divisions");
        divisions.put(machineName, division);
        return division;
    }

    @Override
    public synchronized Franchise createFranchise(String machineName) {
        if (franchises.containsKey(machineName)) {
            throw new ObjectAlreadyExistsException("Franchise already exists: " + machineName);
        }
        Franchise franchise = new Franchise(machineName, TeamNameUtils.franchiseLabel(machineName));
        franchise.setDistinguishedName("cn=" + machineName + ",ou=franchises");
        franchises.put(machineName, franchise);
        return franchise;
    }

    @Override
    public synchronized List<Division> getDivisions() {
        return new ArrayList<>(divisions.values());
    }

    @Override
    public synchronized List<Franchise> getFranchises() {
        return new ArrayList<>(franchises.values());
    }

    @Override
    public synchronized Team getTeam(String machineName) {
        Team team = teams.get(machineName);
        if (team == null) {
            throw new ObjectNotFoundException("Team not found: " + machineName);
        }
        return team;
    }

    @Override
    public synchronized Team createTeam(String machineName, String displayName) {
        if (teams.containsKey(machineName)) {
            throw new ObjectAlreadyExistsException("Team already exists: " + machineName);
        }
        Team team = new Team(machineName, displayName);
        team.setDistinguishedName("cn=" + machineName + ",ou=teams");
        teams.put(machineName, team);
        log.info("MOCK DIRECTORY - Created team {} ({})", machineName, displayName);
        return team;
    }

    @Override
    public synchronized void addMembership(String uid, GroupRef group) {
        if (!groupExists(group)) {
            throw new ObjectNotFoundException("Group not found: " + group);
        }
        Set<String> uids = members.computeIfAbsent(group, g -> new LinkedHashSet<>());
        if (!uids.add(uid)) {
            throw new ObjectAlreadyExistsException(uid + " is already a member of " + group);
        }
    }

    @Override
    public synchronized Optional<TeamPair> getTeamOwningPair(String teamMachineName) {
        for (Franchise franchise : franchises.values()) {
            for (Division division : divisions.values()) {
                if (TeamNameUtils.machineName(franchise.getMachineName(), division.getMachineName())
                        .equals(teamMachineName)) {
                    return Optional.of(new TeamPair(franchise.getMachineName(), division.getMachineName()));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized List<Team> getTeamsOfUser(String uid) {
        List<Team> result = new ArrayList<>();
        members.forEach((group, uids) -> {
            if (group.kind() == GroupKind.TEAM && uids.contains(uid)) {
                result.add(teams.get(group.machineName()));
            }
        });
        return result;
    }

    // ==================== Inspection helpers ====================

    public synchronized Set<String> getTeamNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(teams.keySet()));
    }

    public synchronized boolean isMember(String uid, GroupRef group) {
        return members.getOrDefault(group, Set.of()).contains(uid);
    }

    public synchronized boolean hasUser(String uid) {
        return users.containsKey(uid);
    }

    private boolean groupExists(GroupRef group) {
        return switch (group.kind()) {
            case TEAM -> teams.containsKey(group.machineName());
            case FRANCHISE -> franchises.containsKey(group.machineName());
            case DIVISION -> divisions.containsKey(group.machineName());
        };
    }
}
