package scriptsync.core.breadcrumb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import scriptsync.core.remote.RemoteFile;
import scriptsync.core.remote.RemoteFileType;
import scriptsync.core.transform.GitFileShim;

class BreadcrumbRegistryTest {
  private static final String CONFIG = "[remote \"origin\"]\n    url = https://example.com/a.git\n";

  private final GitFileShim shim = new GitFileShim(new ObjectMapper());
  private final BreadcrumbRegistry registry = new BreadcrumbRegistry(new BreadcrumbCodec(), shim);

  private final List<RemoteFile> project =
      List.of(
          code(".git/config", CONFIG),
          code("Code", "x"),
          code("other/y", "y"),
          code("lib/.git/config", shim.wrap(CONFIG, ".git/config")),
          code("lib/util", "u"),
          code("lib/deep/.git/config", CONFIG),
          code("lib/deep/x", "x"));

  @Test
  void listSubtrees_returnsEveryBreadcrumbRootSorted() {
    assertEquals(List.of("", "lib", "lib/deep"), registry.listSubtrees(project));
  }

  @Test
  void listSubtrees_withoutRootBreadcrumb_omitsRoot() {
    List<RemoteFile> files = List.of(code("a/.git/config", CONFIG), code("Code", "x"));

    assertEquals(List.of("a"), registry.listSubtrees(files));
  }

  @Test
  void filterToSubtree_stripsPrefixAndLeavesNestedSubtreesOut() {
    List<String> lib = names(registry.filterToSubtree(project, "lib"));
    List<String> root = names(registry.filterToSubtree(project, ""));
    List<String> deep = names(registry.filterToSubtree(project, "/lib/deep/"));

    assertEquals(List.of(".git/config", "util"), lib);
    assertEquals(List.of(".git/config", "Code", "other/y"), root);
    assertEquals(List.of(".git/config", "x"), deep);
  }

  @Test
  void requireBreadcrumb_decodesShimmedAndPlainConfigs() {
    assertEquals("https://example.com/a.git", registry.requireBreadcrumb(project, "lib").remoteUrl());
    assertEquals("https://example.com/a.git", registry.requireBreadcrumb(project, "").remoteUrl());
    assertEquals("main", registry.requireBreadcrumb(project, "lib").branch());
  }

  @Test
  void requireBreadcrumb_missing_throwsNotLinkedWithRemediation() {
    NotLinkedException e =
        assertThrows(NotLinkedException.class, () -> registry.requireBreadcrumb(project, "other"));

    assertEquals("other", e.subtreePath());
    assertTrue(e.getMessage().contains("other/.git/config"));
    assertTrue(e.getMessage().contains("git remote add origin"));
  }

  @Test
  void withLastSync_keepsTheShimEncoding() {
    RemoteFile shimmed = registry.findBreadcrumbFile(project, "lib").orElseThrow();
    LastSync lastSync = new LastSync(Instant.parse("2024-05-01T10:00:00Z"), "sync", 3);

    RemoteFile updated = registry.withLastSync(shimmed, lastSync);

    assertTrue(updated.content().contains("const RAW_CONTENT = "));
    GitBreadcrumb decoded = registry.requireBreadcrumb(List.of(updated), "lib");
    assertEquals(lastSync, decoded.lastSync());
    assertEquals("https://example.com/a.git", decoded.remoteUrl());
  }

  @Test
  void withLastSync_keepsPlainConfigPlain() {
    RemoteFile plain = registry.findBreadcrumbFile(project, "").orElseThrow();

    RemoteFile updated =
        registry.withLastSync(plain, new LastSync(Instant.parse("2024-05-01T10:00:00Z"), "pull-only", 0));

    assertTrue(updated.content().startsWith("[remote \"origin\"]"));
    assertTrue(updated.content().contains("lastSync.direction = pull-only"));
  }

  private static RemoteFile code(String name, String content) {
    return RemoteFile.of(name, RemoteFileType.CODE, content);
  }

  private static List<String> names(List<RemoteFile> files) {
    return files.stream().map(RemoteFile::name).toList();
  }
}
