package scriptsync.core.sync;

import java.util.List;

public record SyncReport(
    boolean success,
    String message,
    List<SubtreeSyncOutcome> subtrees,
    int totalPulled,
    int totalPushed,
    List<String> recommendedCommands) {
  public SyncReport {
    subtrees = List.copyOf(subtrees);
    recommendedCommands = recommendedCommands == null ? List.of() : List.copyOf(recommendedCommands);
  }
}
