package scriptsync.platform.config;

import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import scriptsync.core.breadcrumb.BreadcrumbRegistry;
import scriptsync.core.concurrency.PathLockTable;
import scriptsync.core.git.GitPort;
import scriptsync.core.merge.MergeEngine;
import scriptsync.core.remote.RemoteStorePort;
import scriptsync.core.sync.SubtreeSynchronizer;
import scriptsync.core.sync.SyncProjectUseCase;
import scriptsync.core.sync.WorkingCopyResolver;
import scriptsync.core.transform.ContentTransformer;
import scriptsync.core.write.AtomicFileWriteUseCase;
import scriptsync.core.write.OptimisticConcurrencyGuard;

@Configuration
public class SyncConfig {
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public PathLockTable pathLockTable(Environment environment) {
    return new PathLockTable(
        environment.getProperty(
            "scriptsync.sync.lock-timeout", Duration.class, Duration.ofSeconds(60)));
  }

  @Bean
  public WorkingCopyResolver workingCopyResolver(GitPort gitPort, Environment environment) {
    return new WorkingCopyResolver(
        gitPort, environment.getProperty("scriptsync.sync.base-dir", "~/gas-repos"));
  }

  @Bean
  public SubtreeSynchronizer subtreeSynchronizer(
      RemoteStorePort remoteStore,
      BreadcrumbRegistry breadcrumbRegistry,
      ContentTransformer transformer,
      MergeEngine mergeEngine,
      GitPort gitPort,
      WorkingCopyResolver workingCopyResolver,
      PathLockTable pathLockTable,
      Clock clock) {
    return new SubtreeSynchronizer(
        remoteStore,
        breadcrumbRegistry,
        transformer,
        mergeEngine,
        gitPort,
        workingCopyResolver,
        pathLockTable,
        clock);
  }

  @Bean
  public SyncProjectUseCase syncProjectUseCase(
      RemoteStorePort remoteStore,
      BreadcrumbRegistry breadcrumbRegistry,
      SubtreeSynchronizer subtreeSynchronizer) {
    return new SyncProjectUseCase(remoteStore, breadcrumbRegistry, subtreeSynchronizer);
  }

  @Bean
  public AtomicFileWriteUseCase atomicFileWriteUseCase(
      RemoteStorePort remoteStore,
      BreadcrumbRegistry breadcrumbRegistry,
      ContentTransformer transformer,
      GitPort gitPort,
      WorkingCopyResolver workingCopyResolver,
      PathLockTable pathLockTable,
      Clock clock) {
    return new AtomicFileWriteUseCase(
        remoteStore,
        breadcrumbRegistry,
        transformer,
        gitPort,
        workingCopyResolver,
        new OptimisticConcurrencyGuard(),
        pathLockTable,
        clock);
  }
}
