package scriptsync.core.git;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * The git operations the sync engine relies on. Each method maps the command's exit code to an
 * outcome in one place; anything unexpected surfaces as {@link GitCommandException}.
 */
public interface GitPort {
  boolean isRepository(Path workDir);

  /** {@code git init} followed by {@code git checkout -b <branch>}. */
  void init(Path workDir, String branch);

  /** {@code git remote add origin <url>}; an existing origin is left untouched. */
  void addOrigin(Path workDir, String url);

  /** {@code git add -A}, limited to {@code paths} when any are given. */
  void addAll(Path workDir, String... paths);

  /** {@code git commit -m}, limited to {@code paths} when any are given. Hooks run. */
  CommitResult commit(Path workDir, String message, boolean allowEmpty, String... paths);

  /**
   * Records the whole tree as a commit without running hooks. Used for the pre-merge snapshot and
   * for materialized remote state, neither of which is a user change.
   */
  CommitResult commitSnapshot(Path workDir, String message);

  /** {@code git rev-parse HEAD}; empty while the branch has no commit yet. */
  Optional<String> headCommit(Path workDir);

  /** Content of {@code path} at {@code commit}; empty when the path does not exist there. */
  Optional<byte[]> readFileAtCommit(Path workDir, String commit, String path);

  /** {@code git reset -q -- <paths>}: the index entries go back to {@code HEAD}. */
  void unstage(Path workDir, String... paths);

  /** {@code git reset --keep <commit>}. */
  void resetKeep(Path workDir, String commit);

  List<StatusEntry> status(Path workDir);

  /** Probe: does {@code git worktree list} work here? */
  boolean supportsWorktrees(Path workDir);

  void addWorktree(Path workDir, Path worktreeDir, String commitish);

  void removeWorktree(Path workDir, Path worktreeDir);

  /** Binary-safe {@code git diff <from> <to>}. */
  byte[] diff(Path workDir, String from, String to);

  /** {@code git apply --3way <patch>}. */
  ApplyOutcome applyThreeWay(Path workDir, Path patchFile);

  /**
   * {@code git merge-file -p --diff3} of {@code current}, {@code base} and {@code other}. Does not
   * touch the input files. Labels name the three sides in conflict markers.
   */
  MergeFileResult mergeFile(
      Path workDir, Path current, Path base, Path other, String currentLabel, String otherLabel);
}
