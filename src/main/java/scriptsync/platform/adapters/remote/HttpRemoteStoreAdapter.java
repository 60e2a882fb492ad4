package scriptsync.platform.adapters.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import scriptsync.core.remote.CredentialPort;
import scriptsync.core.remote.RemoteFile;
import scriptsync.core.remote.RemoteFileType;
import scriptsync.core.remote.RemoteStoreException;
import scriptsync.core.remote.RemoteStorePort;

/**
 * Remote store over the project content endpoint. The endpoint only replaces the whole file list,
 * so single-file writes and deletes read the current list first.
 */
public class HttpRemoteStoreAdapter implements RemoteStorePort {
  private static final Logger log = LoggerFactory.getLogger(HttpRemoteStoreAdapter.class);

  private final RestTemplate restTemplate;
  private final CredentialPort credentialPort;
  private final String baseUrl;

  public HttpRemoteStoreAdapter(
      RestTemplate restTemplate, CredentialPort credentialPort, String baseUrl) {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalArgumentException("remote base url must be non-blank.");
    }
    this.restTemplate = restTemplate;
    this.credentialPort = credentialPort;
    this.baseUrl = baseUrl.trim().replaceAll("/+$", "");
  }

  @Override
  public List<RemoteFile> list(String projectId) {
    return toRemoteFiles(projectId, fetch(projectId));
  }

  @Override
  public List<RemoteFile> write(String projectId, String name, String content, RemoteFileType type) {
    List<FileDto> files = new ArrayList<>(fetch(projectId));
    FileDto replacement = new FileDto(name, type, content, null);
    int index = indexOf(files, name);
    if (index >= 0) {
      files.set(index, replacement);
    } else {
      files.add(replacement);
    }
    log.info("Writing {} to project {} ({} files)", name, projectId, files.size());
    return toRemoteFiles(projectId, replace(projectId, files));
  }

  @Override
  public List<RemoteFile> delete(String projectId, String name) {
    List<FileDto> files = new ArrayList<>(fetch(projectId));
    int index = indexOf(files, name);
    if (index < 0) {
      throw new RemoteStoreException(projectId, "File not found in project " + projectId + ": " + name);
    }
    files.remove(index);
    log.info("Deleting {} from project {}", name, projectId);
    return toRemoteFiles(projectId, replace(projectId, files));
  }

  private List<FileDto> fetch(String projectId) {
    RequestEntity<Void> request =
        RequestEntity.get(contentUri(projectId))
            .headers(h -> h.setBearerAuth(credentialPort.getValidToken()))
            .accept(MediaType.APPLICATION_JSON)
            .build();
    return exchange(projectId, request);
  }

  private List<FileDto> replace(String projectId, List<FileDto> files) {
    List<FileDto> outgoing =
        files.stream().map(f -> new FileDto(f.name(), f.type(), f.source(), null)).toList();
    RequestEntity<ContentDto> request =
        RequestEntity.put(contentUri(projectId))
            .headers(h -> h.setBearerAuth(credentialPort.getValidToken()))
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .body(new ContentDto(projectId, outgoing));
    return exchange(projectId, request);
  }

  private List<FileDto> exchange(String projectId, RequestEntity<?> request) {
    try {
      ResponseEntity<ContentDto> response = restTemplate.exchange(request, ContentDto.class);
      ContentDto body = response.getBody();
      return body == null || body.files() == null ? List.of() : body.files();
    } catch (HttpStatusCodeException e) {
      throw new RemoteStoreException(
          projectId,
          "Remote store returned "
              + e.getStatusCode().value()
              + " for project "
              + projectId
              + ": "
              + e.getResponseBodyAsString(),
          e);
    } catch (RestClientException e) {
      throw new RemoteStoreException(
          projectId, "Remote store request failed for project " + projectId + ": " + e.getMessage(), e);
    }
  }

  private URI contentUri(String projectId) {
    if (projectId == null || projectId.isBlank()) {
      throw new IllegalArgumentException("projectId must be non-blank.");
    }
    return URI.create(baseUrl + "/v1/projects/" + projectId.trim() + "/content");
  }

  private static int indexOf(List<FileDto> files, String name) {
    for (int i = 0; i < files.size(); i++) {
      if (files.get(i).name().equals(name)) {
        return i;
      }
    }
    return -1;
  }

  private static List<RemoteFile> toRemoteFiles(String projectId, List<FileDto> files) {
    List<RemoteFile> result = new ArrayList<>(files.size());
    for (int i = 0; i < files.size(); i++) {
      FileDto file = files.get(i);
      if (file.type() == null) {
        throw new RemoteStoreException(projectId, "Remote file without type: " + file.name());
      }
      result.add(new RemoteFile(file.name(), file.type(), file.source(), i, parseTime(file.updateTime())));
    }
    return List.copyOf(result);
  }

  private static Instant parseTime(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(value.trim());
    } catch (DateTimeParseException e) {
      log.warn("Ignoring unparseable remote updateTime: {}", value);
      return null;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ContentDto(String scriptId, List<FileDto> files) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record FileDto(String name, RemoteFileType type, String source, String updateTime) {}
}
