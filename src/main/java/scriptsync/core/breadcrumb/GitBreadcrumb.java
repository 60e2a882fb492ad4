package scriptsync.core.breadcrumb;

/**
 * Parsed {@code <subtree>/.git/config}. {@code localSyncPath} and {@code lastSync} are null until
 * configured or first synced.
 */
public record GitBreadcrumb(
    String remoteUrl, String branch, String localSyncPath, LastSync lastSync) {
  public static final String DEFAULT_BRANCH = "main";

  public GitBreadcrumb {
    branch = branch == null || branch.isBlank() ? DEFAULT_BRANCH : branch;
  }

  public GitBreadcrumb withLastSync(LastSync newLastSync) {
    return new GitBreadcrumb(remoteUrl, branch, localSyncPath, newLastSync);
  }
}
