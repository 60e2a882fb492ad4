package scriptsync.core.write;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Rejects a write when the remote file changed after the local copy was last touched. There is
 * no tolerance window: any local mtime strictly before the remote update time is stale.
 */
public class OptimisticConcurrencyGuard {
  public enum Status {
    OK,
    STALE
  }

  public Status checkInSync(Path localPath, Instant remoteUpdateTime) {
    if (remoteUpdateTime == null || localPath == null || !Files.exists(localPath)) {
      return Status.OK;
    }
    return localModTime(localPath).isBefore(remoteUpdateTime) ? Status.STALE : Status.OK;
  }

  /** @throws StaleWriteException when {@link #checkInSync} reports {@link Status#STALE} */
  public void requireInSync(Path localPath, Instant remoteUpdateTime) {
    if (checkInSync(localPath, remoteUpdateTime) == Status.STALE) {
      throw new StaleWriteException(localPath, localModTime(localPath), remoteUpdateTime);
    }
  }

  private static Instant localModTime(Path localPath) {
    try {
      return Files.getLastModifiedTime(localPath).toInstant();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read modification time of " + localPath, e);
    }
  }
}
