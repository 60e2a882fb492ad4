package scriptsync.core.breadcrumb;

public class NotLinkedException extends RuntimeException {
  private final String subtreePath;

  public NotLinkedException(String subtreePath) {
    super(
        "No git breadcrumb found at "
            + BreadcrumbRegistry.breadcrumbName(subtreePath)
            + ". Breadcrumbs are never created automatically: write "
            + BreadcrumbRegistry.breadcrumbName(subtreePath)
            + " on the remote project containing [remote \"origin\"] url = <repository url> and"
            + " [branch \"main\"], initialize the local repository with `git init` and"
            + " `git remote add origin <repository url>`, then run the sync again.");
    this.subtreePath = subtreePath;
  }

  public String subtreePath() {
    return subtreePath;
  }
}
