package scriptsync.core.merge;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scriptsync.core.git.CommitResult;
import scriptsync.core.git.GitPort;
import scriptsync.core.git.MergeFileResult;
import scriptsync.core.transform.LocalFile;
import scriptsync.core.workspace.LocalTree;

/**
 * Entry point for merging remote content into a working copy. Picks the worktree strategy when
 * the local git supports worktrees and the three-way strategy otherwise.
 */
public class MergeEngine {
  private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

  static final String SNAPSHOT_MESSAGE = "WIP: Save before sync";

  private final GitPort gitPort;
  private final ThreeWayMergeStrategy threeWay;
  private final WorktreeMergeStrategy worktree;

  public MergeEngine(
      GitPort gitPort, ThreeWayMergeStrategy threeWay, WorktreeMergeStrategy worktree) {
    this.gitPort = gitPort;
    this.threeWay = threeWay;
    this.worktree = worktree;
  }

  public MergeStrategy select(Path workDir) {
    return gitPort.supportsWorktrees(workDir) ? worktree : threeWay;
  }

  /**
   * Commits uncommitted local work as a snapshot, then merges {@code incoming} with the selected
   * strategy.
   */
  public MergeOutcome merge(Path workDir, List<LocalFile> incoming) {
    return merge(workDir, incoming, select(workDir));
  }

  public MergeOutcome merge(Path workDir, List<LocalFile> incoming, MergeStrategy strategy) {
    String baseCommit = gitPort.headCommit(workDir).orElse(null);
    CommitResult snapshot = gitPort.commitSnapshot(workDir, SNAPSHOT_MESSAGE);
    if (snapshot.committed()) {
      log.info("Snapshot {} of local changes in {}", snapshot.commitHash(), workDir);
    }

    MergeOutcome outcome = strategy.merge(new MergeRequest(workDir, incoming, baseCommit));
    log.info(
        "{} merge in {}: {} new, {} merged, {} unchanged, {} conflicted",
        strategy.name(),
        workDir,
        outcome.created().size(),
        outcome.merged().size(),
        outcome.unchanged().size(),
        outcome.conflicts().size());
    return outcome;
  }

  /** Textbook three-way merge of three in-memory versions through {@code git merge-file}. */
  public TextMergeResult mergeText(String path, String base, String local, String remote) {
    Path scratch;
    try {
      scratch = Files.createTempDirectory("scriptsync-text-merge-");
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create merge scratch directory.", e);
    }
    try {
      Path localFile = Files.writeString(scratch.resolve("local"), nullToEmpty(local), StandardCharsets.UTF_8);
      Path baseFile = Files.writeString(scratch.resolve("base"), nullToEmpty(base), StandardCharsets.UTF_8);
      Path remoteFile = Files.writeString(scratch.resolve("remote"), nullToEmpty(remote), StandardCharsets.UTF_8);
      MergeFileResult result =
          gitPort.mergeFile(scratch, localFile, baseFile, remoteFile, "local", "remote");
      if (result.isClean()) {
        return new TextMergeResult(result.mergedText(), null);
      }
      return new TextMergeResult(
          result.mergedText(), ConflictMarkers.parse(path, result.mergedText()));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to stage merge inputs.", e);
    } finally {
      LocalTree.deleteRecursively(scratch);
    }
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
