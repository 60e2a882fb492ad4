package scriptsync.core.write;

import java.nio.file.Path;
import java.time.Instant;

public class StaleWriteException extends RuntimeException {
  private final Path localPath;
  private final Instant localModTime;
  private final Instant remoteUpdateTime;

  public StaleWriteException(Path localPath, Instant localModTime, Instant remoteUpdateTime) {
    super(
        "Remote copy of "
            + localPath
            + " changed at "
            + remoteUpdateTime
            + ", after the local copy was last modified at "
            + localModTime
            + ". Run a sync to pull the remote change, then retry the write.");
    this.localPath = localPath;
    this.localModTime = localModTime;
    this.remoteUpdateTime = remoteUpdateTime;
  }

  public Path localPath() {
    return localPath;
  }

  public Instant localModTime() {
    return localModTime;
  }

  public Instant remoteUpdateTime() {
    return remoteUpdateTime;
  }
}
