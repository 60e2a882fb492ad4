package scriptsync.core.write;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OptimisticConcurrencyGuardTest {
  private static final Instant T = Instant.parse("2024-03-01T12:00:00Z");

  private final OptimisticConcurrencyGuard guard = new OptimisticConcurrencyGuard();

  @TempDir Path tempDir;

  @Test
  void localOlderThanRemote_isStale() throws Exception {
    Path file = fileWithMtime(T.minusMillis(1));

    assertEquals(OptimisticConcurrencyGuard.Status.STALE, guard.checkInSync(file, T));
    StaleWriteException e = assertThrows(StaleWriteException.class, () -> guard.requireInSync(file, T));
    assertEquals(T, e.remoteUpdateTime());
  }

  @Test
  void localSameAgeOrNewer_isInSync() throws Exception {
    assertEquals(OptimisticConcurrencyGuard.Status.OK, guard.checkInSync(fileWithMtime(T), T));
    assertEquals(
        OptimisticConcurrencyGuard.Status.OK, guard.checkInSync(fileWithMtime(T.plusSeconds(5)), T));
  }

  @Test
  void missingLocalFileOrUnknownRemoteTime_isInSync() throws Exception {
    assertEquals(OptimisticConcurrencyGuard.Status.OK, guard.checkInSync(tempDir.resolve("nope"), T));
    assertEquals(OptimisticConcurrencyGuard.Status.OK, guard.checkInSync(fileWithMtime(T), null));
  }

  private Path fileWithMtime(Instant mtime) throws Exception {
    Path file = Files.createTempFile(tempDir, "guard", ".js");
    Files.setLastModifiedTime(file, FileTime.from(mtime));
    return file;
  }
}
