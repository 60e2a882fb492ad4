package scriptsync.core.sync;

/**
 * {@code subtreePath} null means every linked sub-tree; {@code ""} is the project root.
 * {@code forceOverwrite} replaces the local tree with the remote one instead of merging.
 */
public record SyncRequest(
    String projectId,
    String subtreePath,
    SyncDirection direction,
    boolean forceOverwrite,
    boolean autoCommit) {
  public SyncRequest {
    if (projectId == null || projectId.isBlank()) {
      throw new IllegalArgumentException("projectId must be non-blank.");
    }
    projectId = projectId.trim();
    direction = direction == null ? SyncDirection.SYNC : direction;
  }

  public static SyncRequest of(String projectId, String subtreePath, SyncDirection direction) {
    return new SyncRequest(projectId, subtreePath, direction, false, true);
  }
}
