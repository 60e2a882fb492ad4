package scriptsync.core.remote;

public interface CredentialPort {
  /** Returns a bearer token accepted by the remote store, refreshing it if needed. */
  String getValidToken();
}
