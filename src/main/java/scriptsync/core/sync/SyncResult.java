package scriptsync.core.sync;

import java.util.List;
import scriptsync.core.merge.MergeConflict;

public record SyncResult(
    String subtreePath,
    String localPath,
    String strategy,
    int filesPulled,
    int filesMerged,
    int filesPushed,
    List<MergeConflict> conflicts) {
  public SyncResult {
    conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
  }
}
