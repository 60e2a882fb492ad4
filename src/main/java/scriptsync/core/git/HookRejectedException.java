package scriptsync.core.git;

import java.nio.file.Path;

/** A commit was refused, normally by a pre-commit or commit-msg hook. */
public class HookRejectedException extends RuntimeException {
  private final Path workDir;
  private final String hookOutput;

  public HookRejectedException(Path workDir, String hookOutput) {
    super(
        "Local validation rejected the commit in "
            + workDir
            + (hookOutput == null || hookOutput.isBlank() ? "." : ": " + hookOutput.trim()));
    this.workDir = workDir;
    this.hookOutput = hookOutput;
  }

  public Path workDir() {
    return workDir;
  }

  public String hookOutput() {
    return hookOutput;
  }
}
