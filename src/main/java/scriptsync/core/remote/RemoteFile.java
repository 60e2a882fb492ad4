package scriptsync.core.remote;

import java.time.Instant;

/**
 * One entry of a remote project's flat file list. {@code name} may contain {@code /} for logical
 * grouping; the remote store has no real directories.
 */
public record RemoteFile(
    String name, RemoteFileType type, String content, int position, Instant updateTime) {
  public RemoteFile {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Remote file name must be non-blank.");
    }
    if (type == null) {
      throw new IllegalArgumentException("Remote file type is required: " + name);
    }
    content = content == null ? "" : content;
  }

  public static RemoteFile of(String name, RemoteFileType type, String content) {
    return new RemoteFile(name, type, content, 0, null);
  }

  public RemoteFile withName(String newName) {
    return new RemoteFile(newName, type, content, position, updateTime);
  }
}
