package org.cspii.intranet.client;

import org.cspii.intranet.model.domain.FolderPermission;

import java.util.Map;
import java.util.Optional;

/**
 * Group folder operations of the groupware system.
 */
public interface FolderGateway {

    Optional<Long> findFolder(String path);

    /**
     * @return the id the groupware assigned to the new folder
     */
    long createFolder(String path);

    void grantAccess(long folderId, String groupId);

    void setPermission(long folderId, String groupId, FolderPermission permission);

    /**
     * Groups with access to the folder and their permission mask.
     */
    Map<String, Integer> getGroupPermissions(long folderId);
}
