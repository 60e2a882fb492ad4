package scriptsync.core.merge;

import java.util.List;

public record MergeConflict(String path, List<ConflictSpan> markers) {
  public MergeConflict {
    markers = markers == null ? List.of() : List.copyOf(markers);
  }
}
