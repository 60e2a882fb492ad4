package scriptsync.core.write;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scriptsync.core.breadcrumb.BreadcrumbRegistry;
import scriptsync.core.breadcrumb.GitBreadcrumb;
import scriptsync.core.concurrency.PathLockTable;
import scriptsync.core.git.CommitResult;
import scriptsync.core.git.GitPort;
import scriptsync.core.git.HookRejectedException;
import scriptsync.core.remote.RemoteFile;
import scriptsync.core.remote.RemoteStoreException;
import scriptsync.core.remote.RemoteStorePort;
import scriptsync.core.sync.WorkingCopyResolver;
import scriptsync.core.transform.ContentTransformer;
import scriptsync.core.transform.LocalFile;
import scriptsync.core.workspace.LocalTree;

/**
 * Single-file write or delete in three phases:
 *
 * <ol>
 *   <li>apply the change locally and commit it, letting git hooks validate it; a rejected commit
 *       restores the previous local state and nothing is pushed;
 *   <li>push the committed (possibly hook-modified) content;
 *   <li>if the push fails, reset the working copy to the commit it had before phase 1.
 * </ol>
 *
 * A stale local copy is rejected before phase 1.
 */
public class AtomicFileWriteUseCase {
  private static final Logger log = LoggerFactory.getLogger(AtomicFileWriteUseCase.class);

  private final RemoteStorePort remoteStore;
  private final BreadcrumbRegistry breadcrumbRegistry;
  private final ContentTransformer transformer;
  private final GitPort gitPort;
  private final WorkingCopyResolver workingCopyResolver;
  private final OptimisticConcurrencyGuard guard;
  private final PathLockTable lockTable;
  private final Clock clock;

  public AtomicFileWriteUseCase(
      RemoteStorePort remoteStore,
      BreadcrumbRegistry breadcrumbRegistry,
      ContentTransformer transformer,
      GitPort gitPort,
      WorkingCopyResolver workingCopyResolver,
      OptimisticConcurrencyGuard guard,
      PathLockTable lockTable,
      Clock clock) {
    this.remoteStore = remoteStore;
    this.breadcrumbRegistry = breadcrumbRegistry;
    this.transformer = transformer;
    this.gitPort = gitPort;
    this.workingCopyResolver = workingCopyResolver;
    this.guard = guard;
    this.lockTable = lockTable;
    this.clock = clock;
  }

  public WriteResult write(WriteFileCommand command) {
    if (command.content() == null) {
      throw new IllegalArgumentException("content is required for a write.");
    }
    Target target = resolveTarget(command);
    return lockTable.withLock(target.workDir(), () -> writeLocked(command, target));
  }

  public WriteResult delete(WriteFileCommand command) {
    Target target = resolveTarget(command);
    return lockTable.withLock(target.workDir(), () -> deleteLocked(command, target));
  }

  private WriteResult writeLocked(WriteFileCommand command, Target target) {
    Path workDir = target.workDir();
    String path = command.path();
    workingCopyResolver.ensureWorkingCopy(workDir, target.breadcrumb());

    LocalFile candidate = LocalFile.ofText(path, command.content(), clock.instant());
    if (transformer.toRemote(candidate, target.previous()).isEmpty()) {
      throw new IllegalArgumentException("Unsupported file type for the remote project: " + path);
    }
    guard.requireInSync(LocalTree.resolve(workDir, path), remoteUpdateTime(target));

    String headBefore = requireHead(workDir);
    Optional<LocalFile> prior = LocalTree.read(workDir, path);
    LocalTree.write(workDir, path, candidate.content());
    CommitResult commit = commitLocal(workDir, path, prior, message(command, "Update " + path));

    LocalFile committed =
        LocalTree.read(workDir, path)
            .orElseThrow(() -> new IllegalStateException("Hook removed " + path));
    RemoteFile remoteForm =
        transformer
            .toRemote(committed, target.previous())
            .orElseThrow(() -> new IllegalStateException("Unsupported file: " + path));
    String remoteName = withPrefix(command.subtreePath(), remoteForm.name());

    List<RemoteFile> updated;
    try {
      updated = remoteStore.write(command.projectId(), remoteName, remoteForm.content(), remoteForm.type());
    } catch (RemoteStoreException e) {
      rollback(workDir, path, commit, headBefore, prior);
      throw e;
    }

    Instant updateTime = updateTimeOf(updated, remoteName);
    LocalTree.setModifiedTime(workDir, path, updateTime);
    boolean hookModified = !Arrays.equals(committed.content(), candidate.content());
    log.info("Wrote {} as {} (commit {})", path, remoteName, commit.commitHash());
    return new WriteResult(path, remoteName, commit.commitHash(), hookModified, updateTime);
  }

  private WriteResult deleteLocked(WriteFileCommand command, Target target) {
    Path workDir = target.workDir();
    String path = command.path();
    workingCopyResolver.ensureWorkingCopy(workDir, target.breadcrumb());

    Optional<LocalFile> prior = LocalTree.read(workDir, path);
    if (prior.isEmpty() && target.previous() == null) {
      throw new IllegalArgumentException("File exists neither locally nor remotely: " + path);
    }
    guard.requireInSync(LocalTree.resolve(workDir, path), remoteUpdateTime(target));

    String headBefore = requireHead(workDir);
    CommitResult commit;
    if (prior.isPresent()) {
      LocalTree.delete(workDir, path);
      commit = commitLocal(workDir, path, prior, message(command, "Delete " + path));
    } else {
      commit = new CommitResult(CommitResult.Outcome.NOTHING_TO_COMMIT, null, "");
    }

    String remoteName = null;
    if (target.previous() != null) {
      remoteName = withPrefix(command.subtreePath(), target.previous().name());
      try {
        remoteStore.delete(command.projectId(), remoteName);
      } catch (RemoteStoreException e) {
        rollback(workDir, path, commit, headBefore, prior);
        throw e;
      }
    }
    log.info("Deleted {} (commit {})", path, commit.commitHash());
    return new WriteResult(path, remoteName, commit.commitHash(), false, null);
  }

  /** Phase 1. On rejection the previous local state is restored before the exception leaves. */
  private CommitResult commitLocal(
      Path workDir, String path, Optional<LocalFile> prior, String message) {
    gitPort.addAll(workDir, path);
    CommitResult commit = gitPort.commit(workDir, message, false, path);
    if (commit.outcome() == CommitResult.Outcome.REJECTED) {
      restore(workDir, path, prior);
      gitPort.unstage(workDir, path);
      throw new HookRejectedException(workDir, commit.output());
    }
    return commit;
  }

  /** Phase 3. */
  private void rollback(
      Path workDir, String path, CommitResult commit, String headBefore, Optional<LocalFile> prior) {
    if (!commit.committed()) {
      restore(workDir, path, prior);
      return;
    }
    log.warn("Remote push failed; resetting {} to {}", workDir, headBefore);
    try {
      // hooks may have left unstaged edits, which would block reset --keep
      Optional<byte[]> committedContent = gitPort.readFileAtCommit(workDir, commit.commitHash(), path);
      if (committedContent.isPresent()) {
        LocalTree.write(workDir, path, committedContent.get());
      } else {
        LocalTree.delete(workDir, path);
      }
      gitPort.resetKeep(workDir, headBefore);
    } catch (RuntimeException e) {
      log.error("Rollback of commit {} in {} failed", commit.commitHash(), workDir, e);
      throw new RollbackFailedException(commit.commitHash(), headBefore, workDir, e);
    }
    // uncommitted edits the transaction started from come back as they were
    restore(workDir, path, prior);
  }

  private static void restore(Path workDir, String path, Optional<LocalFile> prior) {
    if (prior.isPresent()) {
      LocalTree.write(workDir, path, prior.get().content());
      LocalTree.setModifiedTime(workDir, path, prior.get().modTime());
    } else {
      LocalTree.delete(workDir, path);
    }
  }

  private Target resolveTarget(WriteFileCommand command) {
    String subtree = BreadcrumbRegistry.normalize(command.subtreePath());
    List<RemoteFile> remoteFiles = remoteStore.list(command.projectId());
    GitBreadcrumb breadcrumb = breadcrumbRegistry.requireBreadcrumb(remoteFiles, subtree);
    Path workDir = workingCopyResolver.resolve(command.projectId(), subtree, breadcrumb);
    RemoteFile previous =
        breadcrumbRegistry.filterToSubtree(remoteFiles, subtree).stream()
            .filter(f -> transformer.localPathFor(f).equals(command.path()))
            .findFirst()
            .orElse(null);
    return new Target(workDir, breadcrumb, previous);
  }

  private String requireHead(Path workDir) {
    return gitPort
        .headCommit(workDir)
        .orElseThrow(() -> new IllegalStateException("Working copy has no commit: " + workDir));
  }

  private static Instant remoteUpdateTime(Target target) {
    return target.previous() == null ? null : target.previous().updateTime();
  }

  private static Instant updateTimeOf(List<RemoteFile> files, String name) {
    return files.stream()
        .filter(f -> f.name().equals(name))
        .map(RemoteFile::updateTime)
        .findFirst()
        .orElse(null);
  }

  private static String message(WriteFileCommand command, String fallback) {
    String reason = command.changeReason();
    return reason == null || reason.isBlank() ? fallback : reason.trim();
  }

  private static String withPrefix(String subtreePath, String name) {
    String subtree = BreadcrumbRegistry.normalize(subtreePath);
    return subtree.isEmpty() ? name : subtree + "/" + name;
  }

  private record Target(Path workDir, GitBreadcrumb breadcrumb, RemoteFile previous) {}
}
