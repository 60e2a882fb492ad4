package scriptsync.core.breadcrumb;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import scriptsync.core.remote.RemoteFile;
import scriptsync.core.transform.GitFileShim;

/**
 * Finds the independently synced sub-trees of a remote project. A sub-tree is declared by a
 * {@code <path>/.git/config} file (or {@code .git/config} for the root) and owns every file
 * beneath it except those owned by a deeper breadcrumb.
 */
public class BreadcrumbRegistry {
  public static final String BREADCRUMB_FILE = ".git/config";

  private final BreadcrumbCodec codec;
  private final GitFileShim gitFileShim;

  public BreadcrumbRegistry(BreadcrumbCodec codec, GitFileShim gitFileShim) {
    this.codec = codec;
    this.gitFileShim = gitFileShim;
  }

  public static String breadcrumbName(String subtreePath) {
    String path = normalize(subtreePath);
    return path.isEmpty() ? BREADCRUMB_FILE : path + "/" + BREADCRUMB_FILE;
  }

  /** Linked sub-tree paths ordered by path; the root is {@code ""}. */
  public List<String> listSubtrees(List<RemoteFile> remoteFiles) {
    return new ArrayList<>(roots(remoteFiles));
  }

  /**
   * Files owned by {@code subtreePath}, renamed relative to it. Files of nested sub-trees are left
   * out.
   */
  public List<RemoteFile> filterToSubtree(List<RemoteFile> remoteFiles, String subtreePath) {
    String path = normalize(subtreePath);
    TreeSet<String> roots = roots(remoteFiles);
    roots.add(path);

    List<RemoteFile> result = new ArrayList<>();
    for (RemoteFile file : remoteFiles) {
      String owner = owner(file.name(), roots);
      if (owner != null && owner.equals(path)) {
        result.add(path.isEmpty() ? file : file.withName(file.name().substring(path.length() + 1)));
      }
    }
    return result;
  }

  public Optional<RemoteFile> findBreadcrumbFile(List<RemoteFile> remoteFiles, String subtreePath) {
    String name = breadcrumbName(subtreePath);
    return remoteFiles.stream().filter(f -> f.name().equals(name)).findFirst();
  }

  public GitBreadcrumb requireBreadcrumb(List<RemoteFile> remoteFiles, String subtreePath) {
    RemoteFile file =
        findBreadcrumbFile(remoteFiles, subtreePath)
            .orElseThrow(() -> new NotLinkedException(normalize(subtreePath)));
    return codec.decode(gitFileShim.unwrap(file.content()));
  }

  /** The breadcrumb file with {@code lastSync} rewritten, in the same encoding it came in. */
  public RemoteFile withLastSync(RemoteFile breadcrumbFile, LastSync lastSync) {
    String raw = gitFileShim.unwrap(breadcrumbFile.content());
    GitBreadcrumb updated = codec.decode(raw).withLastSync(lastSync);
    String text = codec.encode(updated, raw);
    String content =
        raw.equals(breadcrumbFile.content())
            ? text
            : gitFileShim.wrap(text, BREADCRUMB_FILE);
    return new RemoteFile(
        breadcrumbFile.name(),
        breadcrumbFile.type(),
        content,
        breadcrumbFile.position(),
        breadcrumbFile.updateTime());
  }

  public static String normalize(String subtreePath) {
    if (subtreePath == null) {
      return "";
    }
    String path = subtreePath.strip().replace('\\', '/');
    while (path.startsWith("/") || path.startsWith("./")) {
      path = path.startsWith("/") ? path.substring(1) : path.substring(2);
    }
    while (path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    return path;
  }

  private static TreeSet<String> roots(List<RemoteFile> remoteFiles) {
    TreeSet<String> roots = new TreeSet<>();
    for (RemoteFile file : remoteFiles) {
      String name = file.name();
      if (name.equals(BREADCRUMB_FILE)) {
        roots.add("");
      } else if (name.endsWith("/" + BREADCRUMB_FILE)) {
        roots.add(name.substring(0, name.length() - BREADCRUMB_FILE.length() - 1));
      }
    }
    return roots;
  }

  // Nearest (longest) enclosing root, or null when no root encloses the name.
  private static String owner(String name, TreeSet<String> roots) {
    String best = null;
    for (String root : roots) {
      boolean encloses = root.isEmpty() || name.startsWith(root + "/");
      if (encloses && (best == null || root.length() > best.length())) {
        best = root;
      }
    }
    return best;
  }
}
