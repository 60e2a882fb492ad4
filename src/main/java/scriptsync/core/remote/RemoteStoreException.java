package scriptsync.core.remote;

public class RemoteStoreException extends RuntimeException {
  private final String projectId;

  public RemoteStoreException(String projectId, String message) {
    super(message);
    this.projectId = projectId;
  }

  public RemoteStoreException(String projectId, String message, Throwable cause) {
    super(message, cause);
    this.projectId = projectId;
  }

  public String projectId() {
    return projectId;
  }
}
