package scriptsync.platform.adapters.remote;

import scriptsync.core.remote.CredentialPort;

/** Uses a token provisioned out of band; refresh is the provisioning side's job. */
public class StaticTokenCredentialAdapter implements CredentialPort {
  private final String token;

  public StaticTokenCredentialAdapter(String token) {
    this.token = token == null ? null : token.trim();
  }

  @Override
  public String getValidToken() {
    if (token == null || token.isEmpty()) {
      throw new IllegalStateException(
          "No remote access token configured. Set scriptsync.remote.token or SCRIPTSYNC_REMOTE_TOKEN.");
    }
    return token;
  }
}
