package scriptsync.core.merge;

import java.util.List;

/**
 * Result of merging one remote file set into a working copy. Paths are relative to the working
 * copy.
 */
public record MergeOutcome(
    String strategy,
    List<String> created,
    List<String> merged,
    List<String> unchanged,
    List<MergeConflict> conflicts) {
  public MergeOutcome {
    created = List.copyOf(created);
    merged = List.copyOf(merged);
    unchanged = List.copyOf(unchanged);
    conflicts = List.copyOf(conflicts);
  }

  public boolean hasConflicts() {
    return !conflicts.isEmpty();
  }

  /** Files whose local content changed because of the remote side. */
  public int pulledCount() {
    return created.size() + merged.size();
  }

  public List<String> conflictPaths() {
    return conflicts.stream().map(MergeConflict::path).toList();
  }
}
