package scriptsync.core.breadcrumb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class BreadcrumbCodecTest {
  private final BreadcrumbCodec codec = new BreadcrumbCodec();

  @Test
  void decode_readsOriginBranchAndSyncSection() {
    String text =
        "[core]\n"
            + "\trepositoryformatversion = 0\n"
            + "[remote \"origin\"]\n"
            + "\turl = git@example.com:team/app.git\n"
            + "[branch \"develop\"]\n"
            + "\tremote = origin\n"
            + "[sync]\n"
            + "\tlocalPath = ~/work/app\n"
            + "\tlastSync.timestamp = 2024-01-02T03:04:05Z\n"
            + "\tlastSync.direction = push-only\n"
            + "\tlastSync.filesChanged = 4\n";

    GitBreadcrumb breadcrumb = codec.decode(text);

    assertEquals("git@example.com:team/app.git", breadcrumb.remoteUrl());
    assertEquals("develop", breadcrumb.branch());
    assertEquals("~/work/app", breadcrumb.localSyncPath());
    assertEquals(
        new LastSync(Instant.parse("2024-01-02T03:04:05Z"), "push-only", 4), breadcrumb.lastSync());
  }

  @Test
  void decode_minimalConfig_defaultsBranchToMain() {
    GitBreadcrumb breadcrumb = codec.decode("[remote \"origin\"]\n  url = https://x/y.git\n");

    assertEquals("main", breadcrumb.branch());
    assertNull(breadcrumb.localSyncPath());
    assertNull(breadcrumb.lastSync());
  }

  @Test
  void encode_keepsUnknownEntriesAndAddsBranchTracking() {
    String previous = "[core]\n    bare = false\n[remote \"origin\"]\n    url = https://x/y.git\n";
    GitBreadcrumb breadcrumb =
        codec
            .decode(previous)
            .withLastSync(new LastSync(Instant.parse("2024-06-01T00:00:00Z"), "sync", 2));

    String encoded = codec.encode(breadcrumb, previous);

    assertTrue(encoded.contains("[core]\n    bare = false\n"));
    assertTrue(encoded.contains("[branch \"main\"]\n    remote = origin\n    merge = refs/heads/main\n"));
    assertTrue(encoded.contains("lastSync.timestamp = 2024-06-01T00:00:00Z"));
    assertEquals(breadcrumb, codec.decode(encoded));
  }

  @Test
  void decode_invalidTimestamp_isRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> codec.decode("[sync]\n    lastSync.timestamp = yesterday\n"));
  }
}
