package org.cspii.intranet.client.impl;

import lombok.extern.slf4j.Slf4j;
import org.cspii.intranet.client.FolderGateway;
import org.cspii.intranet.client.exception.ObjectAlreadyExistsException;
import org.cspii.intranet.client.exception.ObjectNotFoundException;
import org.cspii.intranet.model.domain.FolderPermission;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Group folders kept in memory. Records every grant so tests can count them.
 */
@Slf4j
@Service
@Profile("test")
public class MockFolderGateway implements FolderGateway {

    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<String, Long> foldersByPath = new LinkedHashMap<>();
    private final Map<Long, Map<String, FolderPermission>> grants = new HashMap<>();
    private final List<String> grantLog = new ArrayList<>();

    @Override
    public synchronized Optional<Long> findFolder(String path) {
        return Optional.ofNullable(foldersByPath.get(path));
    }

    @Override
    public synchronized long createFolder(String path) {
        if (foldersByPath.containsKey(path)) {
            throw new ObjectAlreadyExistsException("Folder already exists: " + path);
        }
        long id = nextId.getAndIncrement();
        foldersByPath.put(path, id);
        grants.put(id, new LinkedHashMap<>());
        log.info("MOCK FOLDERS - Created folder '{}' with id {}", path, id);
        return id;
    }

    @Override
    public synchronized void grantAccess(long folderId, String groupId) {
        folder(folderId).put(groupId, FolderPermission.ALL);
        grantLog.add(folderId + ":" + groupId);
    }

    @Override
    public synchronized void setPermission(long folderId, String groupId, FolderPermission permission) {
        Map<String, FolderPermission> folder = folder(folderId);
        if (!folder.containsKey(groupId)) {
            throw new ObjectNotFoundException("Group " + groupId + " has no access to folder " + folderId);
        }
        folder.put(groupId, permission);
    }

    @Override
    public synchronized Map<String, Integer> getGroupPermissions(long folderId) {
        Map<String, Integer> masks = new LinkedHashMap<>();
        folder(folderId).forEach((group, permission) -> masks.put(group, permission.getValue()));
        return masks;
    }

    // ==================== Inspection helpers ====================

    public synchronized int folderCount() {
        return foldersByPath.size();
    }

    public synchronized Map<String, FolderPermission> getGrants(long folderId) {
        return Map.copyOf(folder(folderId));
    }

    /**
     * Every grantAccess call in order, as {@code folderId:groupId}.
     */
    public synchronized List<String> getGrantLog() {
        return List.copyOf(grantLog);
    }

    private Map<String, FolderPermission> folder(long folderId) {
        Map<String, FolderPermission> folder = grants.get(folderId);
        if (folder == null) {
            throw new ObjectNotFoundException("Folder not found: " + folderId);
        }
        return folder;
    }
}
