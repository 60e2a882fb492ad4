package scriptsync.core.merge;

import java.nio.file.Path;
import java.util.List;
import scriptsync.core.transform.LocalFile;

/**
 * Input of a merge strategy: the working copy, the remote files already in local form, and the
 * commit that was {@code HEAD} before the pre-merge snapshot (null for a fresh working copy).
 */
public record MergeRequest(Path workDir, List<LocalFile> incoming, String baseCommit) {
  public MergeRequest {
    incoming = List.copyOf(incoming);
  }
}
