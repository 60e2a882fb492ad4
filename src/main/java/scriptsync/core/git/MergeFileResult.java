package scriptsync.core.git;

/** Output of {@code git merge-file -p}; {@code conflictCount} is zero for a clean merge. */
public record MergeFileResult(String mergedText, int conflictCount) {
  public boolean isClean() {
    return conflictCount == 0;
  }
}
