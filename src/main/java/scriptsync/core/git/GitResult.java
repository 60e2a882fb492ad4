package scriptsync.core.git;

/** Raw outcome of one git invocation. Interpretation of the exit code is per command. */
public record GitResult(int exitCode, String stdout, String stderr) {
  public boolean isSuccess() {
    return exitCode == 0;
  }
}
