package scriptsync.core.sync;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scriptsync.core.breadcrumb.BreadcrumbRegistry;
import scriptsync.core.breadcrumb.GitBreadcrumb;
import scriptsync.core.breadcrumb.LastSync;
import scriptsync.core.concurrency.PathLockTable;
import scriptsync.core.git.CommitResult;
import scriptsync.core.git.GitPort;
import scriptsync.core.git.HookRejectedException;
import scriptsync.core.merge.ConflictMarkers;
import scriptsync.core.merge.MergeConflict;
import scriptsync.core.merge.MergeConflictException;
import scriptsync.core.merge.MergeEngine;
import scriptsync.core.merge.MergeOutcome;
import scriptsync.core.remote.RemoteFile;
import scriptsync.core.remote.RemoteStorePort;
import scriptsync.core.transform.ContentTransformer;
import scriptsync.core.transform.LocalFile;
import scriptsync.core.workspace.LocalTree;

/**
 * Runs one sub-tree through pull, merge, commit, push and breadcrumb update, strictly in that
 * order, holding the working-copy lock for the whole run.
 */
public class SubtreeSynchronizer {
  private static final Logger log = LoggerFactory.getLogger(SubtreeSynchronizer.class);

  static final String MERGE_COMMIT_MESSAGE = "Merged changes from remote";
  static final String FORCE_COMMIT_MESSAGE = "Force sync from remote";

  private final RemoteStorePort remoteStore;
  private final BreadcrumbRegistry breadcrumbRegistry;
  private final ContentTransformer transformer;
  private final MergeEngine mergeEngine;
  private final GitPort gitPort;
  private final WorkingCopyResolver workingCopyResolver;
  private final PathLockTable lockTable;
  private final Clock clock;

  public SubtreeSynchronizer(
      RemoteStorePort remoteStore,
      BreadcrumbRegistry breadcrumbRegistry,
      ContentTransformer transformer,
      MergeEngine mergeEngine,
      GitPort gitPort,
      WorkingCopyResolver workingCopyResolver,
      PathLockTable lockTable,
      Clock clock) {
    this.remoteStore = remoteStore;
    this.breadcrumbRegistry = breadcrumbRegistry;
    this.transformer = transformer;
    this.mergeEngine = mergeEngine;
    this.gitPort = gitPort;
    this.workingCopyResolver = workingCopyResolver;
    this.lockTable = lockTable;
    this.clock = clock;
  }

  /**
   * Syncs {@code subtreePath} against {@code remoteFiles}, the full remote listing fetched once by
   * the caller. Conflicts come back in the result and stop the run before anything is pushed.
   */
  public SyncResult sync(SyncRequest request, String subtreePath, List<RemoteFile> remoteFiles) {
    GitBreadcrumb breadcrumb = breadcrumbRegistry.requireBreadcrumb(remoteFiles, subtreePath);
    List<RemoteFile> files = breadcrumbRegistry.filterToSubtree(remoteFiles, subtreePath);
    Path workDir = workingCopyResolver.resolve(request.projectId(), subtreePath, breadcrumb);

    return lockTable.withLock(
        workDir, () -> syncLocked(request, subtreePath, remoteFiles, files, breadcrumb, workDir));
  }

  private SyncResult syncLocked(
      SyncRequest request,
      String subtreePath,
      List<RemoteFile> remoteFiles,
      List<RemoteFile> files,
      GitBreadcrumb breadcrumb,
      Path workDir) {
    workingCopyResolver.ensureWorkingCopy(workDir, breadcrumb);
    requireNoUnresolvedMarkers(workDir);

    Map<String, RemoteFile> remoteByLocalPath = new HashMap<>();
    List<LocalFile> incoming = new ArrayList<>();
    List<LocalFile> mirrors = new ArrayList<>();
    for (RemoteFile file : files) {
      LocalFile local = transformer.toLocal(file);
      remoteByLocalPath.put(local.relativePath(), file);
      if (local.relativePath().startsWith(ContentTransformer.BREADCRUMB_MIRROR_DIR + "/")) {
        mirrors.add(local);
      } else {
        incoming.add(local);
      }
    }

    MergeOutcome outcome =
        request.forceOverwrite() ? overwrite(workDir, incoming) : mergeEngine.merge(workDir, incoming);
    writeMirrors(workDir, mirrors);

    if (outcome.hasConflicts()) {
      log.warn("Sub-tree '{}' has {} conflict(s); nothing pushed", subtreePath, outcome.conflicts().size());
      return result(subtreePath, workDir, outcome, 0);
    }

    if (request.autoCommit() || request.forceOverwrite()) {
      commitMerge(workDir, request.forceOverwrite() ? FORCE_COMMIT_MESSAGE : MERGE_COMMIT_MESSAGE);
    }

    if (!request.direction().pushes()) {
      return result(subtreePath, workDir, outcome, 0);
    }

    int pushed = push(request.projectId(), subtreePath, workDir, remoteByLocalPath);
    updateBreadcrumb(request, subtreePath, remoteFiles, workDir, pushed);
    return result(subtreePath, workDir, outcome, pushed);
  }

  private MergeOutcome overwrite(Path workDir, List<LocalFile> incoming) {
    // keep the discarded local state reachable from history
    gitPort.commitSnapshot(workDir, "WIP: Save before forced sync");
    LocalTree.clearExceptGit(workDir);
    List<String> written = new ArrayList<>();
    for (LocalFile file : incoming) {
      LocalTree.write(workDir, file.relativePath(), file.content());
      written.add(file.relativePath());
    }
    log.warn("Force-overwrote {} with {} remote file(s)", workDir, written.size());
    return new MergeOutcome("force-overwrite", written, List.of(), List.of(), List.of());
  }

  private static void writeMirrors(Path workDir, List<LocalFile> mirrors) {
    for (LocalFile mirror : mirrors) {
      LocalTree.write(workDir, mirror.relativePath(), mirror.content());
    }
  }

  private void commitMerge(Path workDir, String message) {
    gitPort.addAll(workDir);
    CommitResult commit = gitPort.commit(workDir, message, false);
    if (commit.outcome() == CommitResult.Outcome.REJECTED) {
      throw new HookRejectedException(workDir, commit.output());
    }
  }

  private int push(
      String projectId, String subtreePath, Path workDir, Map<String, RemoteFile> remoteByLocalPath) {
    int pushed = 0;
    for (LocalFile local : LocalTree.readAll(workDir)) {
      RemoteFile previous = remoteByLocalPath.get(local.relativePath());
      if (previous != null
          && Arrays.equals(local.content(), transformer.toLocal(previous).content())) {
        continue;
      }
      Optional<RemoteFile> remoteForm = transformer.toRemote(local, previous);
      if (remoteForm.isEmpty()) {
        log.debug("Skipping unsupported local file {}", local.relativePath());
        continue;
      }
      if (ConflictMarkers.containsMarkers(local.text())) {
        throw new MergeConflictException(
            workDir, List.of(ConflictMarkers.parse(local.relativePath(), local.text())));
      }

      RemoteFile file = remoteForm.get();
      String name = withPrefix(subtreePath, file.name());
      List<RemoteFile> updated = remoteStore.write(projectId, name, file.content(), file.type());
      updated.stream()
          .filter(f -> f.name().equals(name))
          .findFirst()
          .ifPresent(f -> LocalTree.setModifiedTime(workDir, local.relativePath(), f.updateTime()));
      pushed++;
      log.debug("Pushed {} as {}", local.relativePath(), name);
    }
    return pushed;
  }

  private void updateBreadcrumb(
      SyncRequest request,
      String subtreePath,
      List<RemoteFile> remoteFiles,
      Path workDir,
      int filesChanged) {
    RemoteFile current =
        breadcrumbRegistry
            .findBreadcrumbFile(remoteFiles, subtreePath)
            .orElseThrow(() -> new IllegalStateException("Breadcrumb disappeared: " + subtreePath));
    LastSync lastSync = new LastSync(clock.instant(), request.direction().key(), filesChanged);
    RemoteFile updated = breadcrumbRegistry.withLastSync(current, lastSync);
    remoteStore.write(request.projectId(), updated.name(), updated.content(), updated.type());

    RemoteFile relative =
        updated.withName(BreadcrumbRegistry.BREADCRUMB_FILE);
    LocalFile mirror = transformer.toLocal(relative);
    LocalTree.write(workDir, mirror.relativePath(), mirror.content());
  }

  private static SyncResult result(
      String subtreePath, Path workDir, MergeOutcome outcome, int pushed) {
    return new SyncResult(
        subtreePath,
        workDir.toString(),
        outcome.strategy(),
        outcome.pulledCount(),
        outcome.merged().size(),
        pushed,
        outcome.conflicts());
  }

  private static void requireNoUnresolvedMarkers(Path workDir) {
    List<MergeConflict> unresolved = new ArrayList<>();
    for (LocalFile file : LocalTree.readAll(workDir)) {
      if (ConflictMarkers.containsMarkers(file.text())) {
        unresolved.add(ConflictMarkers.parse(file.relativePath(), file.text()));
      }
    }
    if (!unresolved.isEmpty()) {
      throw new MergeConflictException(workDir, unresolved);
    }
  }

  static String withPrefix(String subtreePath, String name) {
    return subtreePath == null || subtreePath.isEmpty() ? name : subtreePath + "/" + name;
  }
}
