package scriptsync.core.breadcrumb;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/** Reads and writes the git-config text of a breadcrumb. */
public class BreadcrumbCodec {
  static final String REMOTE_ORIGIN = "remote \"origin\"";
  static final String SYNC = "sync";

  public GitBreadcrumb decode(String iniText) {
    IniConfig config = IniConfig.parse(iniText);
    String branch =
        config.firstSubsection("branch").orElseGet(() -> config.get(SYNC, "branch").orElse(null));
    return new GitBreadcrumb(
        config.get(REMOTE_ORIGIN, "url").orElse(null),
        branch,
        config.get(SYNC, "localPath").orElse(null),
        decodeLastSync(config));
  }

  /** Rewrites {@code previousText} with the values of {@code breadcrumb}, keeping other entries. */
  public String encode(GitBreadcrumb breadcrumb, String previousText) {
    IniConfig config = IniConfig.parse(previousText);
    if (breadcrumb.remoteUrl() != null) {
      config.set(REMOTE_ORIGIN, "url", breadcrumb.remoteUrl());
    }
    String branchSection = "branch \"" + breadcrumb.branch() + "\"";
    if (!config.hasSection(branchSection)) {
      config.set(branchSection, "remote", "origin");
      config.set(branchSection, "merge", "refs/heads/" + breadcrumb.branch());
    }
    config.set(SYNC, "localPath", breadcrumb.localSyncPath());

    LastSync lastSync = breadcrumb.lastSync();
    if (lastSync != null) {
      config.set(
          SYNC,
          "lastSync.timestamp",
          lastSync.timestamp() == null ? null : lastSync.timestamp().toString());
      config.set(SYNC, "lastSync.direction", lastSync.direction());
      config.set(SYNC, "lastSync.filesChanged", Integer.toString(lastSync.filesChanged()));
    }
    return config.render();
  }

  private static LastSync decodeLastSync(IniConfig config) {
    String timestamp = config.get(SYNC, "lastSync.timestamp").orElse(null);
    if (timestamp == null) {
      return null;
    }
    Instant parsed;
    try {
      parsed = Instant.parse(timestamp);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid lastSync.timestamp: " + timestamp, e);
    }
    int filesChanged;
    try {
      filesChanged = Integer.parseInt(config.get(SYNC, "lastSync.filesChanged").orElse("0"));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid lastSync.filesChanged.", e);
    }
    return new LastSync(parsed, config.get(SYNC, "lastSync.direction").orElse(null), filesChanged);
  }
}
