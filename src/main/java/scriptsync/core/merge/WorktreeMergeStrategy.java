package scriptsync.core.merge;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scriptsync.core.git.ApplyOutcome;
import scriptsync.core.git.CommitResult;
import scriptsync.core.git.GitPort;
import scriptsync.core.git.StatusEntry;
import scriptsync.core.transform.LocalFile;
import scriptsync.core.workspace.LocalTree;

/**
 * Materializes the remote files in a throwaway worktree, turns the difference
 * into one patch and applies it to the working copy with {@code git apply --3way}. Conflicts are
 * read from {@code git status}; a rejected patch blocks every diverged file in it.
 *
 * <p>The worktree starts at {@code HEAD} (the pre-merge snapshot) for {@link
 * MergeBase#LOCAL_SNAPSHOT}, so the patch always applies cleanly, and at the pre-snapshot commit
 * for {@link MergeBase#LAST_COMMIT}.
 */
public class WorktreeMergeStrategy implements MergeStrategy {
  private static final Logger log = LoggerFactory.getLogger(WorktreeMergeStrategy.class);

  private final GitPort gitPort;
  private final MergeBase mergeBase;

  public WorktreeMergeStrategy(GitPort gitPort, MergeBase mergeBase) {
    this.gitPort = gitPort;
    this.mergeBase = mergeBase == null ? MergeBase.LOCAL_SNAPSHOT : mergeBase;
  }

  @Override
  public String name() {
    return "worktree";
  }

  @Override
  public MergeOutcome merge(MergeRequest request) {
    Path workDir = request.workDir();
    List<String> created = new ArrayList<>();
    List<String> diverged = new ArrayList<>();
    List<String> unchanged = new ArrayList<>();
    for (LocalFile incoming : request.incoming()) {
      Optional<LocalFile> local = LocalTree.read(workDir, incoming.relativePath());
      switch (ThreeWayMergeStrategy.classify(local.orElse(null), incoming)) {
        case NEW_REMOTE -> created.add(incoming.relativePath());
        case UNCHANGED -> unchanged.add(incoming.relativePath());
        case DIVERGED -> diverged.add(incoming.relativePath());
      }
    }
    if (created.isEmpty() && diverged.isEmpty()) {
      return new MergeOutcome(name(), List.of(), List.of(), unchanged, List.of());
    }

    Path scratch = createScratchDir();
    Path worktree = scratch.resolve("worktree");
    boolean worktreeAdded = false;
    try {
      String start =
          mergeBase == MergeBase.LAST_COMMIT && request.baseCommit() != null
              ? request.baseCommit()
              : "HEAD";
      gitPort.addWorktree(workDir, worktree, start);
      worktreeAdded = true;
      for (LocalFile incoming : request.incoming()) {
        LocalTree.write(worktree, incoming.relativePath(), incoming.content());
      }
      CommitResult commit = gitPort.commitSnapshot(worktree, "Remote state for sync");
      if (!commit.committed()) {
        return new MergeOutcome(name(), List.of(), List.of(), unchanged, List.of());
      }

      Path patch = Files.write(scratch.resolve("remote.patch"), gitPort.diff(worktree, "HEAD~1", "HEAD"));
      ApplyOutcome applied = gitPort.applyThreeWay(workDir, patch);
      return switch (applied) {
        case APPLIED -> new MergeOutcome(name(), created, diverged, unchanged, List.of());
        case APPLIED_WITH_CONFLICTS -> withStatusConflicts(workDir, created, diverged, unchanged);
        case REJECTED -> rejected(created, diverged, unchanged);
      };
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write merge patch.", e);
    } finally {
      if (worktreeAdded) {
        removeWorktree(workDir, worktree);
      }
      LocalTree.deleteRecursively(scratch);
    }
  }

  private MergeOutcome withStatusConflicts(
      Path workDir, List<String> created, List<String> diverged, List<String> unchanged) {
    Set<String> conflicted =
        gitPort.status(workDir).stream()
            .filter(StatusEntry::isConflict)
            .map(StatusEntry::path)
            .collect(Collectors.toCollection(TreeSet::new));

    List<MergeConflict> conflicts = new ArrayList<>();
    for (String path : conflicted) {
      String text =
          LocalTree.read(workDir, path)
              .map(f -> new String(f.content(), StandardCharsets.UTF_8))
              .orElse("");
      conflicts.add(ConflictMarkers.parse(path, text));
    }
    return new MergeOutcome(
        name(),
        created.stream().filter(p -> !conflicted.contains(p)).toList(),
        diverged.stream().filter(p -> !conflicted.contains(p)).toList(),
        unchanged,
        conflicts);
  }

  // Nothing was applied; every file that needed the patch is reported without markers.
  private MergeOutcome rejected(List<String> created, List<String> diverged, List<String> unchanged) {
    List<MergeConflict> conflicts = new ArrayList<>();
    for (String path : created) {
      conflicts.add(new MergeConflict(path, List.of()));
    }
    for (String path : diverged) {
      conflicts.add(new MergeConflict(path, List.of()));
    }
    return new MergeOutcome(name(), List.of(), List.of(), unchanged, conflicts);
  }

  private void removeWorktree(Path workDir, Path worktree) {
    try {
      gitPort.removeWorktree(workDir, worktree);
    } catch (RuntimeException e) {
      // the scratch directory is deleted anyway; git prunes the stale entry later
      log.warn("Failed to remove worktree {}: {}", worktree, e.getMessage());
    }
  }

  private static Path createScratchDir() {
    try {
      return Files.createTempDirectory("scriptsync-worktree-");
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create worktree scratch directory.", e);
    }
  }
}
