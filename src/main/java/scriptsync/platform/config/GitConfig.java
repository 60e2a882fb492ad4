package scriptsync.platform.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import scriptsync.core.git.GitPort;
import scriptsync.platform.adapters.git.LocalGitAdapter;

@Configuration
public class GitConfig {
  @Bean
  public GitPort gitPort(Environment environment) {
    Duration timeout =
        environment.getProperty("scriptsync.git.timeout", Duration.class, Duration.ofSeconds(30));
    return new LocalGitAdapter(
        timeout,
        environment.getProperty("scriptsync.git.author-name", "scriptsync"),
        environment.getProperty("scriptsync.git.author-email", "scriptsync@localhost"));
  }
}
