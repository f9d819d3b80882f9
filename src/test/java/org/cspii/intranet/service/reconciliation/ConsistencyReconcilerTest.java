package org.cspii.intranet.service.reconciliation;

import org.cspii.intranet.client.DirectoryGateway;
import org.cspii.intranet.client.exception.ObjectNotFoundException;
import org.cspii.intranet.model.domain.Division;
import org.cspii.intranet.model.domain.Team;
import org.cspii.intranet.model.dto.DivisionDrift;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConsistencyReconcilerTest {

    @Mock
    private DirectoryGateway directoryGateway;

    @Mock
    private ConfigDivisionSource configDivisionSource;

    private ConsistencyReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new ConsistencyReconciler(directoryGateway, configDivisionSource, "international");
    }

    @Test
    void emptySourcesGiveEmptyMapping() {
        assertThat(reconciler.reconcile(Map.of(), List.of())).isEmpty();
    }

    @Test
    void configuredOnlyDivision() {
        SortedMap<String, DivisionDrift> result = reconciler.reconcile(Map.of("na", "North America"), List.of());

        assertThat(result).containsOnlyKeys("na");
        DivisionDrift na = result.get("na");
        assertThat(na.existsInConfig()).isTrue();
        assertThat(na.existsInDirectory()).isFalse();
        assertThat(na.configDisplayName()).isEqualTo("North America");
        assertThat(na.directoryDisplayName()).isNull();
    }

    @Test
    void directoryOnlyDivision() {
        SortedMap<String, DivisionDrift> result = reconciler.reconcile(Map.of(), List.of(new Division("na", "North America")));

        DivisionDrift na = result.get("na");
        assertThat(na.existsInConfig()).isFalse();
        assertThat(na.existsInDirectory()).isTrue();
        assertThat(na.configDisplayName()).isNull();
        assertThat(na.directoryDisplayName()).isEqualTo("North America");
    }

    @Test
    void divisionInBothSourcesKeepsBothDisplayNames() {
        SortedMap<String, DivisionDrift> result = reconciler.reconcile(
                Map.of("na", "North America"), List.of(new Division("na", "N. America")));

        DivisionDrift na = result.get("na");
        assertThat(na.existsInConfig()).isTrue();
        assertThat(na.existsInDirectory()).isTrue();
        assertThat(na.configDisplayName()).isEqualTo("North America");
        assertThat(na.directoryDisplayName()).isEqualTo("N. America");
        assertThat(na.hasDisplayNameMismatch()).isTrue();
    }

    @Test
    void directoryDivisionWithoutDescriptionHasNoDisplayName() {
        SortedMap<String, DivisionDrift> result = reconciler.reconcile(Map.of(), List.of(new Division("eu", null)));

        assertThat(result.get("eu").directoryDisplayName()).isNull();
    }

    @Test
    void resultIsOrderedByMachineName() {
        SortedMap<String, DivisionDrift> result = reconciler.reconcile(
                Map.of("sales", "Sales", "it", "IT"),
                List.of(new Division("ops", "Operations"), new Division("it", "IT")));

        assertThat(result.keySet()).containsExactly("it", "ops", "sales");
    }

    @Test
    void reconcileDoesNotTouchTheDirectory() {
        reconciler.reconcile(Map.of("na", "North America"), List.of(new Division("eu", "Europe")));

        verifyNoInteractions(directoryGateway, configDivisionSource);
    }

    @Test
    void reportDriftLoadsConfigurationOnceAndNeverWrites() {
        when(configDivisionSource.loadDivisions()).thenReturn(Map.of("ops", "Operations", "hr", "Human Resources"));
        when(directoryGateway.getDivisions()).thenReturn(List.of(new Division("ops", "Operations"), new Division("pr", "PR")));

        SortedMap<String, DivisionDrift> result = reconciler.reportDrift();

        assertThat(result).containsOnlyKeys("hr", "ops", "pr");
        assertThat(result.get("ops").isConsistent()).isTrue();
        verify(configDivisionSource, times(1)).loadDivisions();
        verify(directoryGateway).getDivisions();
        verifyNoMoreInteractions(directoryGateway);
    }

    @Test
    void missingSingletonsAreReportedNotThrown() {
        when(directoryGateway.getTeam("everybody")).thenReturn(new Team("everybody", "Everybody"));
        when(directoryGateway.getTeam("international")).thenThrow(new ObjectNotFoundException("missing"));

        assertThat(reconciler.checkRequiredSingletons()).containsExactly("international");
    }

    @Test
    void bothSingletonsMissing() {
        when(directoryGateway.getTeam(anyString())).thenThrow(new ObjectNotFoundException("missing"));

        assertThat(reconciler.checkRequiredSingletons()).containsExactly("everybody", "international");
    }
}
