package org.cspii.intranet.client.impl.production;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.cspii.intranet.client.FolderGateway;
import org.cspii.intranet.client.exception.ObjectAlreadyExistsException;
import org.cspii.intranet.client.exception.ObjectNotFoundException;
import org.cspii.intranet.client.exception.GatewayUnavailableException;
import org.cspii.intranet.model.domain.FolderPermission;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Folder gateway for the Nextcloud group folders app, spoken over its OCS API.
 */
@Slf4j
@Service
@Profile("!test")
public class NextcloudFolderGateway implements FolderGateway {

    private static final String FOLDERS_PATH = "/apps/groupfolders/folders?format=json";
    private static final String FOLDER_PATH = "/apps/groupfolders/folders/{id}?format=json";
    private static final String FOLDER_GROUPS_PATH = "/apps/groupfolders/folders/{id}/groups?format=json";
    private static final String FOLDER_GROUP_PATH = "/apps/groupfolders/folders/{id}/groups/{group}?format=json";

    private final RestTemplate restTemplate;

    public NextcloudFolderGateway(@Qualifier("nextcloudRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public Optional<Long> findFolder(String path) {
        JsonNode data = execute("list group folders", () ->
                restTemplate.exchange(FOLDERS_PATH, HttpMethod.GET, null, JsonNode.class));

        // Older releases answer with an object keyed by id, newer ones with an array
        Iterator<JsonNode> folders = data.elements();
        while (folders.hasNext()) {
            JsonNode folder = folders.next();
            if (path.equals(folder.path("mount_point").asText(null))) {
                return Optional.of(folder.path("id").asLong());
            }
        }
        return Optional.empty();
    }

    @Override
    public long createFolder(String path) {
        JsonNode data = execute("create group folder " + path, () ->
                restTemplate.postForEntity(FOLDERS_PATH, form("mountpoint", path), JsonNode.class));
        JsonNode id = data.get("id");
        if (id == null) {
            throw new GatewayUnavailableException("Group folder created without an id: " + path);
        }
        log.info("Created group folder '{}' with id {}", path, id.asLong());
        return id.asLong();
    }

    @Override
    public void grantAccess(long folderId, String groupId) {
        execute("grant " + groupId + " access to folder " + folderId, () ->
                restTemplate.postForEntity(FOLDER_GROUPS_PATH, form("group", groupId), JsonNode.class, folderId));
        log.info("Granted group '{}' access to group folder {}", groupId, folderId);
    }

    @Override
    public void setPermission(long folderId, String groupId, FolderPermission permission) {
        execute("set " + permission + " for " + groupId + " on folder " + folderId, () ->
                restTemplate.postForEntity(FOLDER_GROUP_PATH,
                        form("permissions", String.valueOf(permission.getValue())),
                        JsonNode.class, folderId, groupId));
        log.info("Set permission {} for group '{}' on group folder {}", permission, groupId, folderId);
    }

    @Override
    public Map<String, Integer> getGroupPermissions(long folderId) {
        JsonNode data = execute("read group folder " + folderId, () ->
                restTemplate.exchange(FOLDER_PATH, HttpMethod.GET, null, JsonNode.class, folderId));

        // An empty groups list is serialized as [] instead of {}
        Map<String, Integer> masks = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> groups = data.path("groups").fields();
        while (groups.hasNext()) {
            Map.Entry<String, JsonNode> group = groups.next();
            masks.put(group.getKey(), group.getValue().asInt());
        }
        return masks;
    }

    private static HttpEntity<MultiValueMap<String, String>> form(String key, String value) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add(key, value);
        return new HttpEntity<>(body, headers);
    }

    /**
     * Runs a call, unwraps the OCS envelope and translates HTTP failures into gateway exceptions.
     */
    private JsonNode execute(String action, Supplier<ResponseEntity<JsonNode>> call) {
        ResponseEntity<JsonNode> response;
        try {
            response = call.get();
        } catch (HttpStatusCodeException e) {
            log.error("Nextcloud rejected '{}': {} - {}", action, e.getStatusCode(), e.getResponseBodyAsString());
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                throw new ObjectNotFoundException("Not found while trying to " + action, e);
            }
            if (e.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                throw new ObjectAlreadyExistsException("Already exists while trying to " + action, e);
            }
            throw new GatewayUnavailableException("Nextcloud failed to " + action, e);
        } catch (RestClientException e) {
            log.error("Nextcloud call failed: {}", action, e);
            throw new GatewayUnavailableException("Nextcloud unavailable while trying to " + action, e);
        }

        JsonNode body = response.getBody();
        if (body == null || !body.has("ocs")) {
            throw new GatewayUnavailableException("Unexpected Nextcloud response while trying to " + action);
        }
        return body.path("ocs").path("data");
    }
}
