package scriptsync.core.merge;

import java.nio.file.Path;
import java.util.List;

public class MergeConflictException extends RuntimeException {
  private final List<MergeConflict> conflicts;

  public MergeConflictException(Path workDir, List<MergeConflict> conflicts) {
    super(describe(workDir, conflicts));
    this.conflicts = List.copyOf(conflicts);
  }

  public static String describe(Path workDir, List<MergeConflict> conflicts) {
    return "Merge conflicts in "
        + conflicts.stream().map(MergeConflict::path).toList()
        + " under "
        + workDir
        + ". Resolve the conflict markers (<<<<<<< ... >>>>>>>) in those files, then run the"
        + " sync again. Nothing was pushed.";
  }

  public List<MergeConflict> conflicts() {
    return conflicts;
  }
}
