package scriptsync.core.concurrency;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One mutex per local working-copy directory, keyed by the absolute normalized path. Mutating
 * operations on the same directory run one at a time; different directories do not contend.
 */
public class PathLockTable {
  private static final Logger log = LoggerFactory.getLogger(PathLockTable.class);

  private final ConcurrentMap<Path, ReentrantLock> locks = new ConcurrentHashMap<>();
  private final Duration acquireTimeout;

  public PathLockTable(Duration acquireTimeout) {
    if (acquireTimeout == null || acquireTimeout.isNegative() || acquireTimeout.isZero()) {
      throw new IllegalArgumentException("acquireTimeout must be positive.");
    }
    this.acquireTimeout = acquireTimeout;
  }

  public <T> T withLock(Path path, Supplier<T> action) {
    Path key = key(path);
    ReentrantLock lock = locks.computeIfAbsent(key, ignored -> new ReentrantLock());
    boolean acquired;
    try {
      acquired = lock.tryLock(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for lock on " + key, e);
    }
    if (!acquired) {
      throw new IllegalStateException(
          "Timed out after " + acquireTimeout + " waiting for another operation on " + key);
    }

    log.debug("Locked {}", key);
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public boolean isLocked(Path path) {
    ReentrantLock lock = locks.get(key(path));
    return lock != null && lock.isLocked();
  }

  private static Path key(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path is required.");
    }
    return path.toAbsolutePath().normalize();
  }
}
