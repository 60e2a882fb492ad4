package scriptsync.platform.adapters.git;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scriptsync.core.git.ApplyOutcome;
import scriptsync.core.git.CommitResult;
import scriptsync.core.git.GitCommandException;
import scriptsync.core.git.GitPort;
import scriptsync.core.git.GitResult;
import scriptsync.core.git.MergeFileResult;
import scriptsync.core.git.StatusEntry;

public class LocalGitAdapter implements GitPort {
  private static final Logger log = LoggerFactory.getLogger(LocalGitAdapter.class);

  private final Duration timeout;
  private final String authorName;
  private final String authorEmail;

  public LocalGitAdapter(Duration timeout, String authorName, String authorEmail) {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("git timeout must be positive.");
    }
    this.timeout = timeout;
    this.authorName = authorName;
    this.authorEmail = authorEmail;
  }

  @Override
  public boolean isRepository(Path workDir) {
    if (!Files.isDirectory(workDir.resolve(".git"))) {
      return false;
    }
    return runGit(workDir, "rev-parse", "--git-dir").isSuccess();
  }

  @Override
  public void init(Path workDir, String branch) {
    requireNonBlank(branch, "branch");
    try {
      Files.createDirectories(workDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create working copy: " + workDir, e);
    }
    runGitChecked(workDir, "init", "-q");
    runGitChecked(workDir, "checkout", "-q", "-b", branch.trim());
  }

  @Override
  public void addOrigin(Path workDir, String url) {
    requireNonBlank(url, "url");
    GitResult result = runGit(workDir, "remote", "add", "origin", url.trim());
    // exit 3: remote already exists
    if (!result.isSuccess() && result.exitCode() != 3) {
      throw new GitCommandException(List.of("remote", "add", "origin", url), result);
    }
  }

  @Override
  public void addAll(Path workDir, String... paths) {
    runGitChecked(workDir, withPaths(List.of("add", "-A"), paths));
  }

  @Override
  public CommitResult commit(Path workDir, String message, boolean allowEmpty, String... paths) {
    return runCommit(workDir, message, allowEmpty, false, paths);
  }

  private CommitResult runCommit(
      Path workDir, String message, boolean allowEmpty, boolean skipHooks, String... paths) {
    requireNonBlank(message, "message");
    List<String> args = new ArrayList<>(identityArgs());
    args.addAll(List.of("commit", "-q", "-m", message));
    if (allowEmpty) {
      args.add("--allow-empty");
    }
    if (skipHooks) {
      args.add("--no-verify");
    }
    GitResult result = runGit(workDir, withPaths(args, paths));
    if (result.isSuccess()) {
      String hash = headCommit(workDir).orElseThrow(() -> new GitCommandException(args, result));
      return new CommitResult(CommitResult.Outcome.COMMITTED, hash, result.stdout());
    }
    String output = result.stdout() + result.stderr();
    if (output.contains("nothing to commit") || output.contains("no changes added to commit")) {
      return new CommitResult(CommitResult.Outcome.NOTHING_TO_COMMIT, null, output.trim());
    }
    log.info("Commit rejected in {}: {}", workDir, output.trim());
    return new CommitResult(CommitResult.Outcome.REJECTED, null, output.trim());
  }

  @Override
  public CommitResult commitSnapshot(Path workDir, String message) {
    addAll(workDir);
    return runCommit(workDir, message, false, true);
  }

  @Override
  public Optional<String> headCommit(Path workDir) {
    GitResult result = runGit(workDir, "rev-parse", "--verify", "-q", "HEAD");
    if (result.isSuccess()) {
      return Optional.of(result.stdout().trim());
    }
    if (result.exitCode() == 1) {
      return Optional.empty();
    }
    throw new GitCommandException(List.of("rev-parse", "--verify", "-q", "HEAD"), result);
  }

  @Override
  public Optional<byte[]> readFileAtCommit(Path workDir, String commit, String path) {
    requireNonBlank(commit, "commit");
    requireNonBlank(path, "path");
    String objectName = commit.trim() + ":" + path;
    if (!runGit(workDir, "cat-file", "-e", objectName).isSuccess()) {
      return Optional.empty();
    }
    List<String> args = List.of("show", objectName);
    GitOutput output = runGitRaw(workDir, args);
    if (output.exitCode() != 0) {
      throw new GitCommandException(args, output.toResult());
    }
    return Optional.of(output.stdout());
  }

  @Override
  public void unstage(Path workDir, String... paths) {
    if (paths == null || paths.length == 0) {
      throw new IllegalArgumentException("at least one path is required.");
    }
    runGitChecked(workDir, withPaths(List.of("reset", "-q"), paths));
  }

  @Override
  public void resetKeep(Path workDir, String commit) {
    requireNonBlank(commit, "commit");
    runGitChecked(workDir, "reset", "-q", "--keep", commit.trim());
  }

  @Override
  public List<StatusEntry> status(Path workDir) {
    String stdout = runGitChecked(workDir, "status", "--porcelain", "-z").stdout();
    return parseStatus(stdout);
  }

  @Override
  public boolean supportsWorktrees(Path workDir) {
    return runGit(workDir, "worktree", "list").isSuccess();
  }

  @Override
  public void addWorktree(Path workDir, Path worktreeDir, String commitish) {
    runGitChecked(
        workDir, "worktree", "add", "-q", "--detach", worktreeDir.toString(), commitish);
  }

  @Override
  public void removeWorktree(Path workDir, Path worktreeDir) {
    runGitChecked(workDir, "worktree", "remove", "--force", worktreeDir.toString());
  }

  @Override
  public byte[] diff(Path workDir, String from, String to) {
    List<String> args = List.of("diff", "--binary", from, to);
    GitOutput output = runGitRaw(workDir, args);
    if (output.exitCode() != 0) {
      throw new GitCommandException(args, output.toResult());
    }
    return output.stdout();
  }

  @Override
  public ApplyOutcome applyThreeWay(Path workDir, Path patchFile) {
    GitResult result = runGit(workDir, "apply", "--3way", patchFile.toString());
    if (result.isSuccess()) {
      return ApplyOutcome.APPLIED;
    }
    // exit 1 with conflicted index entries: applied, markers left in the tree
    if (result.exitCode() == 1 && status(workDir).stream().anyMatch(StatusEntry::isConflict)) {
      return ApplyOutcome.APPLIED_WITH_CONFLICTS;
    }
    log.warn("git apply --3way rejected patch in {}: {}", workDir, result.stderr().trim());
    return ApplyOutcome.REJECTED;
  }

  @Override
  public MergeFileResult mergeFile(
      Path workDir, Path current, Path base, Path other, String currentLabel, String otherLabel) {
    List<String> args =
        List.of(
            "merge-file",
            "-p",
            "--diff3",
            "-L",
            currentLabel,
            "-L",
            "base",
            "-L",
            otherLabel,
            current.toString(),
            base.toString(),
            other.toString());
    GitResult result = runGit(workDir, args);
    // exit 0: clean, 1..127: number of conflicts, anything else: error
    if (result.exitCode() >= 0 && result.exitCode() < 128) {
      return new MergeFileResult(result.stdout(), result.exitCode());
    }
    throw new GitCommandException(args, result);
  }

  private List<String> identityArgs() {
    List<String> args = new ArrayList<>();
    if (authorName != null && !authorName.isBlank()) {
      args.addAll(List.of("-c", "user.name=" + authorName));
    }
    if (authorEmail != null && !authorEmail.isBlank()) {
      args.addAll(List.of("-c", "user.email=" + authorEmail));
    }
    return args;
  }

  private static List<String> withPaths(List<String> args, String... paths) {
    if (paths == null || paths.length == 0) {
      return args;
    }
    List<String> result = new ArrayList<>(args);
    result.add("--");
    result.addAll(Arrays.asList(paths));
    return result;
  }

  private static List<StatusEntry> parseStatus(String stdout) {
    if (stdout == null || stdout.isEmpty()) {
      return List.of();
    }

    String[] entries = stdout.split("\u0000", -1);
    List<StatusEntry> results = new ArrayList<>();
    for (int i = 0; i < entries.length; i++) {
      String entry = entries[i];
      if (entry == null || entry.length() < 4) {
        continue;
      }
      String code = entry.substring(0, 2);
      results.add(new StatusEntry(code.trim(), entry.substring(3)));
      // renames and copies carry the source path as an extra entry
      if (code.charAt(0) == 'R' || code.charAt(0) == 'C') {
        i++;
      }
    }
    return results;
  }

  private static void requireNonBlank(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must be non-blank.");
    }
  }

  private GitResult runGitChecked(Path workDir, String... args) {
    return runGitChecked(workDir, List.of(args));
  }

  private GitResult runGitChecked(Path workDir, List<String> args) {
    GitResult result = runGit(workDir, args);
    if (!result.isSuccess()) {
      throw new GitCommandException(args, result);
    }
    return result;
  }

  private GitResult runGit(Path workDir, String... args) {
    return runGit(workDir, List.of(args));
  }

  private GitResult runGit(Path workDir, List<String> args) {
    return runGitRaw(workDir, args).toResult();
  }

  private GitOutput runGitRaw(Path workDir, List<String> args) {
    List<String> command = new ArrayList<>();
    command.add("git");
    command.addAll(args);

    Process process;
    try {
      process = new ProcessBuilder(command).directory(workDir.toFile()).start();
    } catch (IOException e) {
      throw new GitCommandException(args, "failed to start git process: " + e.getMessage());
    }
    log.debug("git {} in {}", String.join(" ", args), workDir);

    StreamReader stdoutReader = new StreamReader(process.getInputStream());
    StreamReader stderrReader = new StreamReader(process.getErrorStream());

    Thread stdoutThread = new Thread(stdoutReader, "git-stdout-reader");
    Thread stderrThread = new Thread(stderrReader, "git-stderr-reader");
    stdoutThread.setDaemon(true);
    stderrThread.setDaemon(true);
    stdoutThread.start();
    stderrThread.start();

    boolean finished;
    try {
      finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new GitCommandException(args, "interrupted while waiting for git");
    }

    if (!finished) {
      process.destroyForcibly();
      throw new GitCommandException(args, "timed out after " + timeout + " in " + workDir);
    }

    try {
      stdoutThread.join();
      stderrThread.join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GitCommandException(args, "interrupted while reading git output");
    }

    stdoutReader.throwIfFailed();
    stderrReader.throwIfFailed();

    return new GitOutput(process.exitValue(), stdoutReader.bytes(), stderrReader.bytes());
  }

  private record GitOutput(int exitCode, byte[] stdout, byte[] stderr) {
    GitResult toResult() {
      return new GitResult(
          exitCode,
          new String(stdout, StandardCharsets.UTF_8),
          new String(stderr, StandardCharsets.UTF_8));
    }
  }

  private static final class StreamReader implements Runnable {
    private final InputStream inputStream;
    private volatile byte[] bytes;
    private volatile RuntimeException failure;

    private StreamReader(InputStream inputStream) {
      this.inputStream = inputStream;
    }

    @Override
    public void run() {
      try (inputStream) {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        inputStream.transferTo(output);
        bytes = output.toByteArray();
      } catch (IOException e) {
        failure = new UncheckedIOException(e);
      }
    }

    public byte[] bytes() {
      return bytes == null ? new byte[0] : bytes;
    }

    public void throwIfFailed() {
      if (failure != null) {
        throw failure;
      }
    }
  }
}
