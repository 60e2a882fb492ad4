package scriptsync.platform.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;
import org.springframework.web.client.RestTemplate;
import scriptsync.core.remote.CredentialPort;
import scriptsync.core.remote.RemoteStorePort;
import scriptsync.platform.adapters.remote.HttpRemoteStoreAdapter;
import scriptsync.platform.adapters.remote.StaticTokenCredentialAdapter;

@Configuration
@Profile("!test")
public class RemoteStoreConfig {
  @Bean
  public RestTemplate restTemplate() {
    return new RestTemplate();
  }

  @Bean
  public CredentialPort credentialPort(Environment environment) {
    String token = environment.getProperty("SCRIPTSYNC_REMOTE_TOKEN");
    if (token == null || token.isBlank()) {
      token = environment.getProperty("scriptsync.remote.token");
    }
    return new StaticTokenCredentialAdapter(token);
  }

  @Bean
  public RemoteStorePort remoteStorePort(
      RestTemplate restTemplate, CredentialPort credentialPort, Environment environment) {
    return new HttpRemoteStoreAdapter(
        restTemplate,
        credentialPort,
        environment.getProperty("scriptsync.remote.base-url", "https://script.googleapis.com"));
  }
}
