package scriptsync.core.git;

public record CommitResult(Outcome outcome, String commitHash, String output) {
  public enum Outcome {
    COMMITTED,
    NOTHING_TO_COMMIT,
    /** A hook (or another precondition) refused the commit. */
    REJECTED
  }

  public boolean committed() {
    return outcome == Outcome.COMMITTED;
  }
}
