package scriptsync.core.sync;

/** Per sub-tree entry of a {@link SyncReport}; {@code result} is null when the run failed early. */
public record SubtreeSyncOutcome(
    String subtreePath, boolean success, SyncResult result, String error) {
  static SubtreeSyncOutcome succeeded(SyncResult result) {
    return new SubtreeSyncOutcome(result.subtreePath(), true, result, null);
  }

  static SubtreeSyncOutcome failed(String subtreePath, SyncResult result, String error) {
    return new SubtreeSyncOutcome(subtreePath, false, result, error);
  }
}
