package scriptsync.core.sync;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scriptsync.core.breadcrumb.GitBreadcrumb;
import scriptsync.core.git.CommitResult;
import scriptsync.core.git.GitPort;
import scriptsync.core.transform.ContentTransformer;

/** Locates and initializes the local git working copy of a sub-tree. */
public class WorkingCopyResolver {
  private static final Logger log = LoggerFactory.getLogger(WorkingCopyResolver.class);

  // Placeholder url for projects that have no upstream repository.
  private static final String LOCAL_ONLY_URL = "local";

  private final GitPort gitPort;
  private final Path baseDir;

  public WorkingCopyResolver(GitPort gitPort, String baseDir) {
    if (baseDir == null || baseDir.isBlank()) {
      throw new IllegalArgumentException("baseDir must be non-blank.");
    }
    this.gitPort = gitPort;
    this.baseDir = expandHome(baseDir.trim());
  }

  /**
   * The breadcrumb's {@code sync.localPath} when set, otherwise
   * {@code <baseDir>/project-<projectId>[-<subtree with / replaced by ->]}.
   */
  public Path resolve(String projectId, String subtreePath, GitBreadcrumb breadcrumb) {
    if (breadcrumb != null
        && breadcrumb.localSyncPath() != null
        && !breadcrumb.localSyncPath().isBlank()) {
      return expandHome(breadcrumb.localSyncPath().trim()).toAbsolutePath().normalize();
    }
    String folder = "project-" + projectId;
    if (subtreePath != null && !subtreePath.isEmpty()) {
      folder += "-" + subtreePath.replace('/', '-');
    }
    return baseDir.resolve(folder).toAbsolutePath().normalize();
  }

  /** Idempotent: init, branch, origin and an initial empty commit so that HEAD exists. */
  public void ensureWorkingCopy(Path workDir, GitBreadcrumb breadcrumb) {
    if (gitPort.isRepository(workDir)) {
      excludeMirrorDir(workDir);
      return;
    }
    log.info("Initializing working copy {} on branch {}", workDir, breadcrumb.branch());
    gitPort.init(workDir, breadcrumb.branch());
    String url = breadcrumb.remoteUrl();
    if (url != null && !url.isBlank() && !LOCAL_ONLY_URL.equals(url.trim())) {
      gitPort.addOrigin(workDir, url);
    }
    excludeMirrorDir(workDir);
    CommitResult initial = gitPort.commit(workDir, "Initialize sync working copy", true);
    if (!initial.committed()) {
      throw new IllegalStateException(
          "Failed to create the initial commit in " + workDir + ": " + initial.output());
    }
  }

  // Breadcrumb mirrors must never be committed to the user's repository.
  private static void excludeMirrorDir(Path workDir) {
    Path exclude = workDir.resolve(".git").resolve("info").resolve("exclude");
    String entry = "/" + ContentTransformer.BREADCRUMB_MIRROR_DIR + "/";
    try {
      String current = Files.exists(exclude) ? Files.readString(exclude, StandardCharsets.UTF_8) : "";
      if (current.lines().anyMatch(line -> line.trim().equals(entry))) {
        return;
      }
      Files.createDirectories(exclude.getParent());
      String prefix = current.isEmpty() || current.endsWith("\n") ? current : current + "\n";
      Files.writeString(exclude, prefix + entry + "\n", StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to update " + exclude, e);
    }
  }

  static Path expandHome(String path) {
    if (path.equals("~")) {
      return Path.of(System.getProperty("user.home"));
    }
    if (path.startsWith("~/")) {
      return Path.of(System.getProperty("user.home"), path.substring(2));
    }
    return Path.of(path);
  }
}
