package scriptsync.platform.adapters.remote;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import scriptsync.core.remote.RemoteFile;
import scriptsync.core.remote.RemoteFileType;
import scriptsync.core.remote.RemoteStoreException;
import scriptsync.core.remote.RemoteStorePort;

@Component
@Profile("test")
public class InMemoryRemoteStoreAdapter implements RemoteStorePort {
  private final ConcurrentHashMap<String, List<RemoteFile>> projects = new ConcurrentHashMap<>();
  private final AtomicInteger failNextWrites = new AtomicInteger();
  private final Clock clock;
  private Instant lastUpdate = Instant.EPOCH;

  public InMemoryRemoteStoreAdapter(Clock clock) {
    this.clock = clock;
  }

  @Override
  public List<RemoteFile> list(String projectId) {
    return List.copyOf(projects.getOrDefault(projectId, List.of()));
  }

  @Override
  public synchronized List<RemoteFile> write(
      String projectId, String name, String content, RemoteFileType type) {
    maybeFail(projectId);
    List<RemoteFile> files = new ArrayList<>(projects.getOrDefault(projectId, List.of()));
    RemoteFile updated = new RemoteFile(name, type, content, 0, nextUpdateTime());
    int index = indexOf(files, name);
    if (index >= 0) {
      files.set(index, updated);
    } else {
      files.add(updated);
    }
    return store(projectId, files);
  }

  @Override
  public synchronized List<RemoteFile> delete(String projectId, String name) {
    maybeFail(projectId);
    List<RemoteFile> files = new ArrayList<>(projects.getOrDefault(projectId, List.of()));
    int index = indexOf(files, name);
    if (index < 0) {
      throw new RemoteStoreException(projectId, "File not found in project " + projectId + ": " + name);
    }
    files.remove(index);
    return store(projectId, files);
  }

  /** Replaces a project's files, stamping any file that has no update time. */
  public synchronized void seed(String projectId, Collection<RemoteFile> files) {
    List<RemoteFile> stamped = new ArrayList<>();
    for (RemoteFile file : files) {
      Instant time = file.updateTime() == null ? nextUpdateTime() : file.updateTime();
      stamped.add(new RemoteFile(file.name(), file.type(), file.content(), 0, time));
    }
    store(projectId, stamped);
  }

  /** The next {@code count} writes or deletes fail with {@link RemoteStoreException}. */
  public void failNextWrites(int count) {
    failNextWrites.set(count);
  }

  public synchronized void clear() {
    projects.clear();
    failNextWrites.set(0);
  }

  public Map<String, List<RemoteFile>> snapshot() {
    return Map.copyOf(projects);
  }

  private void maybeFail(String projectId) {
    if (failNextWrites.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
      throw new RemoteStoreException(projectId, "Injected remote store failure.");
    }
  }

  private List<RemoteFile> store(String projectId, List<RemoteFile> files) {
    List<RemoteFile> positioned = new ArrayList<>(files.size());
    for (int i = 0; i < files.size(); i++) {
      RemoteFile f = files.get(i);
      positioned.add(new RemoteFile(f.name(), f.type(), f.content(), i, f.updateTime()));
    }
    List<RemoteFile> result = List.copyOf(positioned);
    projects.put(projectId, result);
    return result;
  }

  // strictly increasing so mtime comparisons stay meaningful within one test
  private Instant nextUpdateTime() {
    Instant now = clock.instant();
    lastUpdate = now.isAfter(lastUpdate) ? now : lastUpdate.plusMillis(1);
    return lastUpdate;
  }

  private static int indexOf(List<RemoteFile> files, String name) {
    for (int i = 0; i < files.size(); i++) {
      if (files.get(i).name().equals(name)) {
        return i;
      }
    }
    return -1;
  }
}
