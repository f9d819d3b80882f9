package org.cspii.intranet.client.impl.production;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cspii.intranet.client.DirectoryGateway;
import org.cspii.intranet.client.exception.ObjectAlreadyExistsException;
import org.cspii.intranet.client.exception.ObjectNotFoundException;
import org.cspii.intranet.client.exception.GatewayUnavailableException;
import org.cspii.intranet.model.domain.Division;
import org.cspii.intranet.model.domain.Franchise;
import org.cspii.intranet.model.domain.GroupKind;
import org.cspii.intranet.model.domain.GroupRef;
import org.cspii.intranet.model.domain.Team;
import org.cspii.intranet.model.domain.TeamPair;
import org.cspii.intranet.model.domain.User;
import org.cspii.intranet.util.LdapUtils;
import org.cspii.intranet.util.TeamNameUtils;
import org.springframework.context.annotation.Profile;
import org.springframework.ldap.AttributeInUseException;
import org.springframework.ldap.NameAlreadyBoundException;
import org.springframework.ldap.NameNotFoundException;
import org.springframework.ldap.NamingException;
import org.springframework.ldap.core.AttributesMapper;
import org.springframework.ldap.core.LdapTemplate;
import org.springframework.ldap.support.LdapNameBuilder;
import org.springframework.stereotype.Service;

import javax.naming.Name;
import javax.naming.directory.Attributes;
import javax.naming.directory.BasicAttribute;
import javax.naming.directory.BasicAttributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.ModificationItem;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.springframework.ldap.query.LdapQueryBuilder.query;

/**
 * Directory gateway backed by an LDAP server through Spring LDAP.
 *
 * <p>Layout below the context base:
 * <pre>
 *   ou=people      uid=&lt;uid&gt;          inetOrgPerson
 *   ou=divisions   cn=&lt;machine name&gt;   group, description = display name
 *   ou=franchises  cn=&lt;machine name&gt;   group, description = display name
 *   ou=teams       cn=&lt;machine name&gt;   group, description = display name
 * </pre>
 * Groups list their members in {@code memberUid}.
 */
@Slf4j
@Service
@Profile("!test")
@RequiredArgsConstructor
public class LdapDirectoryGateway implements DirectoryGateway {

    private static final String PEOPLE_OU = "people";
    private static final String DIVISIONS_OU = "divisions";
    private static final String FRANCHISES_OU = "franchises";
    private static final String TEAMS_OU = "teams";

    private static final String[] PERSON_OBJECT_CLASSES = {"top", "person", "organizationalPerson", "inetOrgPerson"};
    private static final String[] GROUP_OBJECT_CLASSES = {"top", "extensibleObject"};

    private static final String MEMBER_ATTRIBUTE = "memberUid";

    private final LdapTemplate ldapTemplate;

    @Override
    public User createUser(String uid, String givenName, String surname, String password) {
        Name dn = personDn(uid);
        Attributes attrs = new BasicAttributes(true);
        attrs.put(objectClasses(PERSON_OBJECT_CLASSES));
        attrs.put("uid", uid);
        attrs.put("cn", givenName + " " + surname);
        attrs.put("givenName", givenName);
        attrs.put("sn", surname);
        attrs.put("userPassword", password);

        execute("create user " + uid, () -> {
            ldapTemplate.bind(dn, null, attrs);
            return null;
        });
        log.info("Created directory user {}", uid);

        User user = new User(uid, givenName, surname);
        user.setDistinguishedName(dn.toString());
        return user;
    }

    @Override
    public User getUser(String uid) {
        Name dn = personDn(uid);
        User user = execute("look up user " + uid, () -> ldapTemplate.lookup(dn, new UserAttributesMapper()));
        user.setDistinguishedName(dn.toString());
        getTeamsOfUser(uid).forEach(team -> user.getTeams().add(team.getMachineName()));
        return user;
    }

    @Override
    public void deleteUser(String uid) {
        execute("delete user " + uid, () -> {
            ldapTemplate.unbind(personDn(uid));
            return null;
        });
        log.info("Deleted directory user {}", uid);
    }

    @Override
    public Division createDivision(String machineName, String displayName) {
        Name dn = groupDn(DIVISIONS_OU, machineName);
        bindGroup(dn, machineName, displayName);
        Division division = new Division(machineName, displayName);
        division.setDistinguishedName(dn.toString());
        return division;
    }

    @Override
    public Franchise createFranchise(String machineName) {
        Name dn = groupDn(FRANCHISES_OU, machineName);
        String label = TeamNameUtils.franchiseLabel(machineName);
        bindGroup(dn, machineName, label);
        Franchise franchise = new Franchise(machineName, label);
        franchise.setDistinguishedName(dn.toString());
        return franchise;
    }

    @Override
    public List<Division> getDivisions() {
        return execute("list divisions", () -> ldapTemplate.search(
                query().base(ouDn(DIVISIONS_OU)).where("objectclass").is("extensibleObject"),
                (AttributesMapper<Division>) attrs -> {
                    String cn = LdapUtils.getAttribute(attrs, "cn");
                    Division division = new Division(cn, LdapUtils.getAttribute(attrs, "description"));
                    division.setDistinguishedName(groupDn(DIVISIONS_OU, cn).toString());
                    return division;
                }));
    }

    @Override
    public List<Franchise> getFranchises() {
        return execute("list franchises", () -> ldapTemplate.search(
                query().base(ouDn(FRANCHISES_OU)).where("objectclass").is("extensibleObject"),
                (AttributesMapper<Franchise>) attrs -> {
                    String cn = LdapUtils.getAttribute(attrs, "cn");
                    Franchise franchise = new Franchise(cn, LdapUtils.getAttribute(attrs, "description"));
                    franchise.setDistinguishedName(groupDn(FRANCHISES_OU, cn).toString());
                    return franchise;
                }));
    }

    @Override
    public Team getTeam(String machineName) {
        Name dn = groupDn(TEAMS_OU, machineName);
        Team team = execute("look up team " + machineName, () -> ldapTemplate.lookup(dn, new TeamAttributesMapper()));
        team.setDistinguishedName(dn.toString());
        return team;
    }

    @Override
    public Team createTeam(String machineName, String displayName) {
        Name dn = groupDn(TEAMS_OU, machineName);
        bindGroup(dn, machineName, displayName);
        Team team = new Team(machineName, displayName);
        team.setDistinguishedName(dn.toString());
        return team;
    }

    @Override
    public void addMembership(String uid, GroupRef group) {
        Name dn = groupDn(ouFor(group.kind()), group.machineName());
        ModificationItem[] mods = {
                new ModificationItem(DirContext.ADD_ATTRIBUTE, new BasicAttribute(MEMBER_ATTRIBUTE, uid))
        };
        execute("add " + uid + " to " + dn, () -> {
            ldapTemplate.modifyAttributes(dn, mods);
            return null;
        });
        log.debug("Added {} to {}", uid, dn);
    }

    @Override
    public Optional<TeamPair> getTeamOwningPair(String teamMachineName) {
        // Team entries carry no back-reference, so match against the derived names
        List<Franchise> franchises = getFranchises();
        List<Division> divisions = getDivisions();
        for (Franchise franchise : franchises) {
            for (Division division : divisions) {
                if (TeamNameUtils.machineName(franchise.getMachineName(), division.getMachineName())
                        .equals(teamMachineName)) {
                    return Optional.of(new TeamPair(franchise.getMachineName(), division.getMachineName()));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public List<Team> getTeamsOfUser(String uid) {
        return execute("list teams of " + uid, () -> ldapTemplate.search(
                query().base(ouDn(TEAMS_OU)).where(MEMBER_ATTRIBUTE).is(uid),
                new TeamAttributesMapper()));
    }

    private void bindGroup(Name dn, String machineName, String displayName) {
        Attributes attrs = new BasicAttributes(true);
        attrs.put(objectClasses(GROUP_OBJECT_CLASSES));
        attrs.put("cn", machineName);
        if (displayName != null) {
            attrs.put("description", displayName);
        }
        execute("create " + dn, () -> {
            ldapTemplate.bind(dn, null, attrs);
            return null;
        });
        log.info("Created directory group {}", dn);
    }

    /**
     * Runs a directory call and translates Spring LDAP exceptions into gateway exceptions.
     */
    private <T> T execute(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (NameNotFoundException e) {
            throw new ObjectNotFoundException("Not found while trying to " + action, e);
        } catch (NameAlreadyBoundException | AttributeInUseException e) {
            throw new ObjectAlreadyExistsException("Already exists while trying to " + action, e);
        } catch (NamingException e) {
            log.error("Directory call failed: {}", action, e);
            throw new GatewayUnavailableException("Directory unavailable while trying to " + action, e);
        }
    }

    private static String ouFor(GroupKind kind) {
        return switch (kind) {
            case TEAM -> TEAMS_OU;
            case FRANCHISE -> FRANCHISES_OU;
            case DIVISION -> DIVISIONS_OU;
        };
    }

    private static Name ouDn(String ou) {
        return LdapNameBuilder.newInstance().add("ou", ou).build();
    }

    private static Name personDn(String uid) {
        return LdapNameBuilder.newInstance().add("ou", PEOPLE_OU).add("uid", uid).build();
    }

    private static Name groupDn(String ou, String cn) {
        return LdapNameBuilder.newInstance().add("ou", ou).add("cn", cn).build();
    }

    private static BasicAttribute objectClasses(String[] classes) {
        BasicAttribute objectClass = new BasicAttribute("objectClass");
        for (String c : classes) {
            objectClass.add(c);
        }
        return objectClass;
    }

    private static class UserAttributesMapper implements AttributesMapper<User> {
        @Override
        public User mapFromAttributes(Attributes attrs) throws javax.naming.NamingException {
            User user = new User(
                    LdapUtils.getAttribute(attrs, "uid"),
                    LdapUtils.getAttribute(attrs, "givenName"),
                    LdapUtils.getAttribute(attrs, "sn"));
            user.setMail(LdapUtils.getAttribute(attrs, "mail"));
            return user;
        }
    }

    private static class TeamAttributesMapper implements AttributesMapper<Team> {
        @Override
        public Team mapFromAttributes(Attributes attrs) throws javax.naming.NamingException {
            String cn = LdapUtils.getAttribute(attrs, "cn");
            Team team = new Team(cn, LdapUtils.getAttribute(attrs, "description"));
            team.setDistinguishedName(groupDn(TEAMS_OU, cn).toString());
            return team;
        }
    }
}
