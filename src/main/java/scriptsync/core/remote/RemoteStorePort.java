package scriptsync.core.remote;

import java.util.List;

/** Remote script-project store. Every call may fail with {@link RemoteStoreException}. */
public interface RemoteStorePort {
  List<RemoteFile> list(String projectId);

  /** Creates or replaces {@code name}; returns the full updated file list. */
  List<RemoteFile> write(String projectId, String name, String content, RemoteFileType type);

  /** Removes {@code name}; returns the full updated file list. */
  List<RemoteFile> delete(String projectId, String name);
}
