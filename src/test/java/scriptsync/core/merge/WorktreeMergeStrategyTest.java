package scriptsync.core.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import scriptsync.core.git.ApplyOutcome;
import scriptsync.core.git.GitPort;
import scriptsync.core.transform.LocalFile;
import scriptsync.platform.adapters.git.LocalGitAdapter;
import scriptsync.testsupport.GitTestRepos;

class WorktreeMergeStrategyTest {
  private static final String BASE = "one\ntwo\nthree\nfour\nfive\n";

  private final GitPort git = new LocalGitAdapter(Duration.ofSeconds(20), "Test User", "test@example.com");

  @TempDir Path workDir;

  @BeforeEach
  void setUp() throws Exception {
    git.init(workDir, "main");
    Files.writeString(workDir.resolve("a.js"), BASE, StandardCharsets.UTF_8);
    git.commitSnapshot(workDir, "last sync");
  }

  @Test
  void appliesRemoteStateAndCleansUpWorktree() throws Exception {
    WorktreeMergeStrategy strategy = new WorktreeMergeStrategy(git, MergeBase.LOCAL_SNAPSHOT);

    MergeOutcome outcome =
        engine(strategy)
            .merge(
                workDir,
                List.of(file("a.js", "one\ntwo\nthree\nfour\nREMOTE\n"), file("b/c.js", "new\n")),
                strategy);

    assertEquals("worktree", outcome.strategy());
    assertEquals(List.of("b/c.js"), outcome.created());
    assertEquals(List.of("a.js"), outcome.merged());
    assertEquals("one\ntwo\nthree\nfour\nREMOTE\n", Files.readString(workDir.resolve("a.js")));
    assertEquals("new\n", Files.readString(workDir.resolve("b/c.js")));
    assertFalse(GitTestRepos.runGit(workDir, "worktree", "list").contains("scriptsync-worktree-"));
  }

  @Test
  void nothingChanged_skipsWorktreeEntirely() throws Exception {
    WorktreeMergeStrategy strategy = new WorktreeMergeStrategy(git, MergeBase.LOCAL_SNAPSHOT);
    int commitsBefore = GitTestRepos.commitCount(workDir);

    MergeOutcome outcome = engine(strategy).merge(workDir, List.of(file("a.js", BASE)), strategy);

    assertEquals(List.of("a.js"), outcome.unchanged());
    assertEquals(0, outcome.pulledCount());
    assertEquals(commitsBefore, GitTestRepos.commitCount(workDir));
  }

  @Test
  void lastCommitBase_overlappingEditsLeaveConflictInStatus() throws Exception {
    Files.writeString(workDir.resolve("a.js"), "one\nmine\nthree\nfour\nfive\n");
    WorktreeMergeStrategy strategy = new WorktreeMergeStrategy(git, MergeBase.LAST_COMMIT);

    MergeOutcome outcome =
        engine(strategy)
            .merge(workDir, List.of(file("a.js", "one\ntheirs\nthree\nfour\nfive\n")), strategy);

    assertEquals(List.of("a.js"), outcome.conflictPaths());
    assertTrue(outcome.merged().isEmpty());
    String text = Files.readString(workDir.resolve("a.js"));
    assertTrue(text.contains("mine"));
    assertTrue(text.contains("theirs"));
    assertTrue(ConflictMarkers.containsMarkers(text));
  }

  @Test
  void rejectedPatch_blocksEveryFileInIt() throws Exception {
    GitPort rejectingGit = spy(git);
    doReturn(ApplyOutcome.REJECTED).when(rejectingGit).applyThreeWay(any(Path.class), any(Path.class));
    Files.writeString(workDir.resolve("a.js"), "one\nmine\nthree\nfour\nfive\n");
    WorktreeMergeStrategy strategy = new WorktreeMergeStrategy(rejectingGit, MergeBase.LAST_COMMIT);
    MergeEngine engine =
        new MergeEngine(
            rejectingGit, new ThreeWayMergeStrategy(rejectingGit, MergeBase.LAST_COMMIT), strategy);

    MergeOutcome outcome =
        engine.merge(
            workDir,
            List.of(file("a.js", "one\ntheirs\nthree\nfour\nfive\n"), file("b.js", "new\n")),
            strategy);

    assertEquals(Set.of("a.js", "b.js"), new HashSet<>(outcome.conflictPaths()));
    assertTrue(outcome.conflicts().stream().allMatch(c -> c.markers().isEmpty()));
    assertTrue(outcome.created().isEmpty());
    assertTrue(outcome.merged().isEmpty());
    assertEquals("one\nmine\nthree\nfour\nfive\n", Files.readString(workDir.resolve("a.js")));
    assertFalse(Files.exists(workDir.resolve("b.js")));
    assertFalse(GitTestRepos.runGit(workDir, "worktree", "list").contains("scriptsync-worktree-"));
  }

  private MergeEngine engine(WorktreeMergeStrategy worktree) {
    return new MergeEngine(git, new ThreeWayMergeStrategy(git, MergeBase.LOCAL_SNAPSHOT), worktree);
  }

  private static LocalFile file(String path, String text) {
    return LocalFile.ofText(path, text, Instant.now());
  }
}
