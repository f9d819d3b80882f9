package org.cspii.intranet.service.folder;

import org.cspii.intranet.client.FolderGateway;
import org.cspii.intranet.client.exception.GatewayUnavailableException;
import org.cspii.intranet.client.impl.MockFolderGateway;
import org.cspii.intranet.model.domain.FolderPermission;
import org.cspii.intranet.model.dto.ErrorKind;
import org.cspii.intranet.model.dto.ItemStatus;
import org.cspii.intranet.model.dto.OperationOutcome;
import org.cspii.intranet.model.dto.OutcomeStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class FolderProvisionerTest {

    private MockFolderGateway folders;
    private FolderProvisioner provisioner;

    @BeforeEach
    void setUp() {
        folders = new MockFolderGateway();
        provisioner = new FolderProvisioner(folders, "Franchises");
    }

    @Test
    void firstFranchiseFolderCreatesReadOnlyContainer() {
        OperationOutcome outcome = provisioner.createFranchiseFolder("east");

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.SUCCEEDED);
        long containerId = folders.findFolder("Franchises").orElseThrow();
        assertThat(folders.getGrants(containerId)).containsEntry("everybody", FolderPermission.READ);
    }

    @Test
    void franchiseGroupGetsFullAccessAndEverybodyReads() {
        provisioner.createFranchiseFolder("east");

        long folderId = folders.findFolder("Franchises/east").orElseThrow();
        assertThat(folders.getGrants(folderId))
                .containsEntry("east", FolderPermission.ALL)
                .containsEntry("everybody", FolderPermission.READ);
    }

    @Test
    void containerIsCreatedAndSharedOnlyOnce() {
        provisioner.createFranchiseFolder("east");
        provisioner.createFranchiseFolder("west");

        long containerId = folders.findFolder("Franchises").orElseThrow();
        assertThat(folders.folderCount()).isEqualTo(3);
        assertThat(folders.getGrantLog()).filteredOn(grant -> grant.equals(containerId + ":everybody")).hasSize(1);
    }

    @Test
    void rerunReusesTheExistingFolder() {
        provisioner.createFranchiseFolder("east");

        OperationOutcome again = provisioner.createFranchiseFolder("east");

        assertThat(again.status()).isEqualTo(OutcomeStatus.SUCCEEDED_WITH_SKIPS);
        assertThat(folders.folderCount()).isEqualTo(2);
    }

    @Test
    void rerunRestoresContainerGrantThatFailedOnCreation() {
        MockFolderGateway gateway = spy(new MockFolderGateway());
        doThrow(new GatewayUnavailableException("timeout")).doCallRealMethod()
                .when(gateway).grantAccess(1L, "everybody");
        FolderProvisioner flaky = new FolderProvisioner(gateway, "Franchises");

        OperationOutcome first = flaky.createFranchiseFolder("east");
        OperationOutcome second = flaky.createFranchiseFolder("east");

        assertThat(first.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(second.isSuccess()).isTrue();
        assertThat(gateway.getGrants(1L)).containsEntry("everybody", FolderPermission.READ);
        assertThat(gateway.findFolder("Franchises/east")).isPresent();
    }

    @Test
    void rerunNarrowsContainerPermissionLeftAtFullAccess() {
        MockFolderGateway gateway = spy(new MockFolderGateway());
        doThrow(new GatewayUnavailableException("timeout")).doCallRealMethod()
                .when(gateway).setPermission(1L, "everybody", FolderPermission.READ);
        FolderProvisioner flaky = new FolderProvisioner(gateway, "Franchises");

        flaky.createFranchiseFolder("east");
        assertThat(gateway.getGrants(1L)).containsEntry("everybody", FolderPermission.ALL);

        flaky.createFranchiseFolder("east");

        assertThat(gateway.getGrants(1L)).containsEntry("everybody", FolderPermission.READ);
        assertThat(gateway.getGrantLog()).filteredOn(grant -> grant.equals("1:everybody")).hasSize(1);
    }

    @Test
    void intactContainerIsLeftAlone() {
        provisioner.createFranchiseFolder("east");
        int grantsAfterFirstRun = folders.getGrantLog().size();

        provisioner.createFranchiseFolder("east");

        long containerId = folders.findFolder("Franchises").orElseThrow();
        assertThat(folders.getGrantLog().subList(grantsAfterFirstRun, folders.getGrantLog().size()))
                .noneMatch(grant -> grant.startsWith(containerId + ":"));
    }

    @Test
    void failedGrantFailsTheWholeOperationWithoutRollback() {
        FolderGateway gateway = mock(FolderGateway.class);
        when(gateway.findFolder("Franchises")).thenReturn(Optional.of(1L));
        when(gateway.getGroupPermissions(1L)).thenReturn(Map.of("everybody", FolderPermission.READ.getValue()));
        when(gateway.findFolder("Franchises/east")).thenReturn(Optional.empty());
        when(gateway.createFolder("Franchises/east")).thenReturn(7L);
        doThrow(new GatewayUnavailableException("timeout")).when(gateway).grantAccess(7L, "everybody");

        OperationOutcome outcome = new FolderProvisioner(gateway, "Franchises").createFranchiseFolder("east");

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.PARTIAL_FAILURE);
        assertThat(outcome.count(ItemStatus.FAILED)).isEqualTo(1);
        verify(gateway).grantAccess(7L, "east");
        verify(gateway, never()).grantAccess(1L, "everybody");
    }

    @Test
    void failedContainerCreationStopsBeforeTheSubfolder() {
        FolderGateway gateway = mock(FolderGateway.class);
        when(gateway.findFolder("Franchises")).thenReturn(Optional.empty());
        when(gateway.createFolder("Franchises")).thenThrow(new GatewayUnavailableException("down"));

        OperationOutcome outcome = new FolderProvisioner(gateway, "Franchises").createFranchiseFolder("east");

        assertThat(outcome.errorKind()).isEqualTo(ErrorKind.GATEWAY_UNAVAILABLE);
        verify(gateway, never()).createFolder("Franchises/east");
        verify(gateway, never()).grantAccess(anyLong(), anyString());
    }
}
