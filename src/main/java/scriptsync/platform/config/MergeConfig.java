package scriptsync.platform.config;

import java.util.Locale;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import scriptsync.core.git.GitPort;
import scriptsync.core.merge.MergeBase;
import scriptsync.core.merge.MergeEngine;
import scriptsync.core.merge.ThreeWayMergeStrategy;
import scriptsync.core.merge.WorktreeMergeStrategy;

@Configuration
public class MergeConfig {
  @Bean
  public MergeBase mergeBase(Environment environment) {
    String value = environment.getProperty("scriptsync.merge.base", "local-snapshot");
    return MergeBase.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
  }

  @Bean
  public ThreeWayMergeStrategy threeWayMergeStrategy(GitPort gitPort, MergeBase mergeBase) {
    return new ThreeWayMergeStrategy(gitPort, mergeBase);
  }

  @Bean
  public WorktreeMergeStrategy worktreeMergeStrategy(GitPort gitPort, MergeBase mergeBase) {
    return new WorktreeMergeStrategy(gitPort, mergeBase);
  }

  @Bean
  public MergeEngine mergeEngine(
      GitPort gitPort, ThreeWayMergeStrategy threeWay, WorktreeMergeStrategy worktree) {
    return new MergeEngine(gitPort, threeWay, worktree);
  }
}
