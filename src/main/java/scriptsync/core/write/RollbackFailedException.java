package scriptsync.core.write;

import java.nio.file.Path;
import java.util.List;

/**
 * The remote push failed and the local commit could not be undone. Local and remote now disagree
 * until someone runs the recovery commands.
 */
public class RollbackFailedException extends RuntimeException {
  private final String commitHash;
  private final Path workDir;
  private final List<String> recoveryCommands;

  public RollbackFailedException(
      String commitHash, String previousHead, Path workDir, Throwable rollbackFailure) {
    super(
        "Remote push failed and rolling back local commit "
            + commitHash
            + " in "
            + workDir
            + " also failed: "
            + rollbackFailure.getMessage()
            + ". Manual recovery required.",
        rollbackFailure);
    this.commitHash = commitHash;
    this.workDir = workDir;
    this.recoveryCommands =
        List.of(
            "cd " + workDir,
            "git status",
            "git stash --include-untracked",
            "git reset --keep " + previousHead);
  }

  public String commitHash() {
    return commitHash;
  }

  public Path workDir() {
    return workDir;
  }

  public List<String> recoveryCommands() {
    return recoveryCommands;
  }
}
