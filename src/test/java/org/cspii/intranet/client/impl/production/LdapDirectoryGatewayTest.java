package org.cspii.intranet.client.impl.production;

import org.cspii.intranet.client.exception.ObjectAlreadyExistsException;
import org.cspii.intranet.client.exception.ObjectNotFoundException;
import org.cspii.intranet.client.exception.GatewayUnavailableException;
import org.cspii.intranet.model.domain.Division;
import org.cspii.intranet.model.domain.Franchise;
import org.cspii.intranet.model.domain.GroupRef;
import org.cspii.intranet.model.domain.TeamPair;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ldap.AttributeInUseException;
import org.springframework.ldap.CommunicationException;
import org.springframework.ldap.NameAlreadyBoundException;
import org.springframework.ldap.NameNotFoundException;
import org.springframework.ldap.core.AttributesMapper;
import org.springframework.ldap.core.LdapTemplate;
import org.springframework.ldap.query.LdapQuery;

import javax.naming.Name;
import javax.naming.directory.Attributes;
import javax.naming.directory.ModificationItem;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LdapDirectoryGatewayTest {

    @Mock
    private LdapTemplate ldapTemplate;

    @InjectMocks
    private LdapDirectoryGateway gateway;

    @Test
    void missingTeamIsNotFound() {
        when(ldapTemplate.lookup(any(Name.class), any(AttributesMapper.class)))
                .thenThrow(new NameNotFoundException(new javax.naming.NameNotFoundException("cn=ghost")));

        assertThatThrownBy(() -> gateway.getTeam("ghost"))
                .isInstanceOf(ObjectNotFoundException.class);
    }

    @Test
    void boundTeamIsAlreadyExists() {
        doThrow(new NameAlreadyBoundException(new javax.naming.NameAlreadyBoundException("cn=east-ops")))
                .when(ldapTemplate).bind(any(Name.class), isNull(), any(Attributes.class));

        assertThatThrownBy(() -> gateway.createTeam("east-ops", "East Operations"))
                .isInstanceOf(ObjectAlreadyExistsException.class);
    }

    @Test
    void existingMemberIsAlreadyExists() {
        doThrow(new AttributeInUseException(new javax.naming.directory.AttributeInUseException("memberUid")))
                .when(ldapTemplate).modifyAttributes(any(Name.class), any(ModificationItem[].class));

        assertThatThrownBy(() -> gateway.addMembership("jdoe", GroupRef.team("east-ops")))
                .isInstanceOf(ObjectAlreadyExistsException.class);
    }

    @Test
    void lostConnectionIsGatewayUnavailable() {
        when(ldapTemplate.search(any(LdapQuery.class), any(AttributesMapper.class)))
                .thenThrow(new CommunicationException(new javax.naming.CommunicationException("connection refused")));

        assertThatThrownBy(() -> gateway.getDivisions())
                .isInstanceOf(GatewayUnavailableException.class);
    }

    @Test
    void listingsSearchBelowTheirOrganizationalUnit() {
        ArgumentCaptor<LdapQuery> queries = ArgumentCaptor.forClass(LdapQuery.class);
        doReturn(List.of()).when(ldapTemplate).search(queries.capture(), any(AttributesMapper.class));

        assertThat(gateway.getDivisions()).isEmpty();
        assertThat(gateway.getFranchises()).isEmpty();
        assertThat(gateway.getTeamsOfUser("jdoe")).isEmpty();

        assertThat(queries.getAllValues()).extracting(query -> query.base().toString())
                .containsExactly("ou=divisions", "ou=franchises", "ou=teams");
        assertThat(queries.getAllValues().get(2).filter().encode()).isEqualTo("(memberUid=jdoe)");
    }

    @Test
    void membershipIsWrittenToTheGroupOfItsKind() {
        ArgumentCaptor<Name> dn = ArgumentCaptor.forClass(Name.class);

        gateway.addMembership("jdoe", GroupRef.franchise("east"));
        gateway.addMembership("jdoe", GroupRef.division("ops"));

        verify(ldapTemplate, times(2)).modifyAttributes(dn.capture(), any(ModificationItem[].class));
        assertThat(dn.getAllValues()).extracting(Name::toString)
                .containsExactly("cn=east,ou=franchises", "cn=ops,ou=divisions");
    }

    @Test
    void franchiseIsLabelledOnCreation() throws Exception {
        ArgumentCaptor<Attributes> attrs = ArgumentCaptor.forClass(Attributes.class);

        Franchise franchise = gateway.createFranchise("de");

        verify(ldapTemplate).bind(any(Name.class), isNull(), attrs.capture());
        assertThat(attrs.getValue().get("description").get()).isEqualTo("Germany");
        assertThat(franchise.getDisplayName()).isEqualTo("Germany");
        assertThat(franchise.isMaterialized()).isTrue();
    }

    @Test
    void owningPairIsResolvedFromDerivedNames() {
        doReturn(List.of(new Franchise("east", "East"), new Franchise("west", "West")))
                .doReturn(List.of(new Division("ops", "Operations"), new Division("sales", "Sales")))
                .when(ldapTemplate).search(any(LdapQuery.class), any(AttributesMapper.class));

        assertThat(gateway.getTeamOwningPair("west-sales")).contains(new TeamPair("west", "sales"));
    }

    @Test
    void distinguishedTeamHasNoOwningPair() {
        doReturn(List.of(new Franchise("east", "East")))
                .doReturn(List.of(new Division("ops", "Operations")))
                .when(ldapTemplate).search(any(LdapQuery.class), any(AttributesMapper.class));

        assertThat(gateway.getTeamOwningPair("everybody")).isEmpty();
    }
}
