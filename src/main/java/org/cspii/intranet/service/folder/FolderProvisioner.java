package org.cspii.intranet.service.folder;

import lombok.extern.slf4j.Slf4j;
import org.cspii.intranet.client.FolderGateway;
import org.cspii.intranet.client.exception.GatewayException;
import org.cspii.intranet.model.domain.FolderPermission;
import org.cspii.intranet.model.dto.ErrorKind;
import org.cspii.intranet.model.dto.ItemResult;
import org.cspii.intranet.model.dto.OperationOutcome;
import org.cspii.intranet.service.SingletonTeamService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Creates the group folder of a franchise below the shared franchises container.
 *
 * <p>The franchise group gets full access to its folder and "everybody" gets read
 * access. Grants already applied are not rolled back when a later call fails; the
 * operation can simply be run again, and a re-run also restores a missing container grant.
 */
@Slf4j
@Service
public class FolderProvisioner {

    private final FolderGateway folderGateway;
    private final String containerFolder;

    public FolderProvisioner(FolderGateway folderGateway,
                             @Value("${app.hierarchy.franchises-folder:Franchises}") String containerFolder) {
        this.folderGateway = folderGateway;
        this.containerFolder = containerFolder;
    }

    public OperationOutcome createFranchiseFolder(String folderName) {
        String everybody = SingletonTeamService.EVERYBODY_MACHINE_NAME;
        String path = containerFolder + "/" + folderName;
        List<ItemResult> items = new ArrayList<>();
        log.info("Provisioning franchise folder '{}'", path);

        try {
            ensureContainer(items);
        } catch (GatewayException e) {
            log.error("Could not prepare container folder '{}'", containerFolder, e);
            items.add(ItemResult.failed(containerFolder, e.getKind(), e.getMessage()));
            return OperationOutcome.failed(e.getKind(), "Container folder " + containerFolder + " not ready", items);
        }

        long folderId;
        try {
            Optional<Long> existing = folderGateway.findFolder(path);
            if (existing.isPresent()) {
                folderId = existing.get();
                items.add(ItemResult.skipped(path, ErrorKind.ALREADY_EXISTS, "Folder already exists"));
            } else {
                folderId = folderGateway.createFolder(path);
                items.add(ItemResult.created(path));
            }
        } catch (GatewayException e) {
            log.error("Could not create folder '{}'", path, e);
            items.add(ItemResult.failed(path, e.getKind(), e.getMessage()));
            return OperationOutcome.fromItems("Create franchise folder " + folderName, items);
        }

        items.add(apply(path + " <- " + folderName, () -> folderGateway.grantAccess(folderId, folderName)));
        items.add(apply(path + " <- " + everybody, () -> folderGateway.grantAccess(folderId, everybody)));
        items.add(apply(path + " <- " + everybody + " " + FolderPermission.READ,
                () -> folderGateway.setPermission(folderId, everybody, FolderPermission.READ)));

        OperationOutcome outcome = OperationOutcome.fromItems("Create franchise folder " + folderName, items);
        if (outcome.isSuccess()) {
            log.info(outcome.message());
        } else {
            log.warn("{}; re-run to complete the grants", outcome.message());
        }
        return outcome;
    }

    /**
     * Create the container on first use, readable by everybody. An existing
     * container only gets the "everybody" grant back if it is missing or changed.
     */
    private void ensureContainer(List<ItemResult> items) {
        String everybody = SingletonTeamService.EVERYBODY_MACHINE_NAME;
        Optional<Long> existing = folderGateway.findFolder(containerFolder);
        if (existing.isEmpty()) {
            long containerId = folderGateway.createFolder(containerFolder);
            items.add(ItemResult.created(containerFolder));
            folderGateway.grantAccess(containerId, everybody);
            folderGateway.setPermission(containerId, everybody, FolderPermission.READ);
            log.info("Created container folder '{}' readable by '{}'", containerFolder, everybody);
            return;
        }

        long containerId = existing.get();
        Integer mask = folderGateway.getGroupPermissions(containerId).get(everybody);
        if (mask != null && mask == FolderPermission.READ.getValue()) {
            return;
        }
        log.warn("Container folder '{}' lacks the {} grant for '{}' (found {}), reapplying",
                containerFolder, FolderPermission.READ, everybody, mask);
        if (mask == null) {
            folderGateway.grantAccess(containerId, everybody);
        }
        folderGateway.setPermission(containerId, everybody, FolderPermission.READ);
        items.add(ItemResult.applied(containerFolder + " <- " + everybody + " " + FolderPermission.READ));
    }

    private ItemResult apply(String target, Runnable call) {
        try {
            call.run();
            return ItemResult.applied(target);
        } catch (GatewayException e) {
            log.error("Grant '{}' failed", target, e);
            return ItemResult.failed(target, e.getKind(), e.getMessage());
        }
    }
}
