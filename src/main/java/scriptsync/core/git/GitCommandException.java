package scriptsync.core.git;

import java.util.List;

public class GitCommandException extends RuntimeException {
  private final List<String> args;
  private final GitResult result;

  public GitCommandException(List<String> args, GitResult result) {
    super(
        "git "
            + String.join(" ", args)
            + " failed (exit="
            + result.exitCode()
            + "): "
            + (result.stderr().isBlank() ? result.stdout().trim() : result.stderr().trim()));
    this.args = List.copyOf(args);
    this.result = result;
  }

  public GitCommandException(List<String> args, String message) {
    super("git " + String.join(" ", args) + ": " + message);
    this.args = List.copyOf(args);
    this.result = null;
  }

  public List<String> args() {
    return args;
  }

  /** Null when git did not run to completion (start failure or timeout). */
  public GitResult result() {
    return result;
  }
}
