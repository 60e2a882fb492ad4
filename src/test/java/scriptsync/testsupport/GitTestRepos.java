package scriptsync.testsupport;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/** Drives the real git binary for test fixtures. */
public final class GitTestRepos {
  private GitTestRepos() {}

  public static void initRepo(Path repoDir) throws Exception {
    Files.createDirectories(repoDir);
    runGit(repoDir, "init", "-q");
    runGit(repoDir, "checkout", "-q", "-b", "main");
    runGit(repoDir, "config", "user.email", "test@example.com");
    runGit(repoDir, "config", "user.name", "Test User");
  }

  public static void commitAll(Path repoDir, String message) throws Exception {
    runGit(repoDir, "add", "-A");
    runGit(repoDir, "commit", "-q", "--allow-empty", "-m", message);
  }

  public static String head(Path repoDir) throws Exception {
    return runGit(repoDir, "rev-parse", "HEAD").trim();
  }

  public static int commitCount(Path repoDir) throws Exception {
    return Integer.parseInt(runGit(repoDir, "rev-list", "--count", "HEAD").trim());
  }

  public static String lastCommitMessage(Path repoDir) throws Exception {
    return runGit(repoDir, "log", "-1", "--format=%s").trim();
  }

  /** Installs an executable {@code pre-commit} hook with the given shell body. */
  public static void installPreCommitHook(Path repoDir, String script) throws IOException {
    Path hook = repoDir.resolve(".git").resolve("hooks").resolve("pre-commit");
    Files.createDirectories(hook.getParent());
    Files.writeString(hook, "#!/bin/sh\n" + script + "\n", StandardCharsets.UTF_8);
    Files.setPosixFilePermissions(hook, PosixFilePermissions.fromString("rwxr-xr-x"));
  }

  public static String runGit(Path repoDir, String... args) throws Exception {
    List<String> command = new ArrayList<>();
    command.add("git");
    command.addAll(List.of(args));

    Process process;
    try {
      ProcessBuilder pb = new ProcessBuilder(command);
      pb.directory(repoDir.toFile());
      pb.redirectErrorStream(false);
      process = pb.start();
    } catch (IOException e) {
      throw new IllegalStateException("Failed to start git in " + repoDir, e);
    }

    String stdout = readAll(process.getInputStream());
    String stderr = readAll(process.getErrorStream());
    boolean finished = process.waitFor(10, TimeUnit.SECONDS);
    if (!finished) {
      process.destroyForcibly();
      throw new IllegalStateException("Timed out while running git in " + repoDir);
    }
    if (process.exitValue() != 0) {
      throw new IllegalStateException(
          "git " + String.join(" ", args) + " failed in " + repoDir + ": " + stderr.trim());
    }
    return stdout;
  }

  private static String readAll(InputStream inputStream) throws IOException {
    try (InputStream in = inputStream; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      in.transferTo(out);
      return out.toString(StandardCharsets.UTF_8);
    }
  }
}
