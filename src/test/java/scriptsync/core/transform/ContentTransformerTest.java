package scriptsync.core.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import scriptsync.core.remote.RemoteFile;
import scriptsync.core.remote.RemoteFileType;
import scriptsync.platform.adapters.markdown.CommonmarkMarkdownConverter;

class ContentTransformerTest {
  private final ContentTransformer transformer =
      new ContentTransformer(new CommonmarkMarkdownConverter(), new GitFileShim(new ObjectMapper()));

  @Test
  void codeFile_isUnwrappedAndUnderscoresBecomeFolders() {
    RemoteFile remote =
        RemoteFile.of(
            "lib_utils",
            RemoteFileType.CODE,
            ModuleShim.wrap("function f(){}", ModuleOptions.NONE, "lib_utils"));

    LocalFile local = transformer.toLocal(remote);

    assertEquals("lib/utils.js", local.relativePath());
    assertEquals("function f(){}", local.text());
  }

  @Test
  void markupAndDataFiles_keepContentAndGetTypeExtension() {
    assertEquals(
        "views/index.html",
        transformer.localPathFor(RemoteFile.of("views_index", RemoteFileType.MARKUP, "<p>x</p>")));
    assertEquals(
        "appsscript.json",
        transformer.localPathFor(RemoteFile.of("appsscript", RemoteFileType.DATA, "{}")));
    assertEquals(
        "{\"a\":1}",
        transformer.toLocal(RemoteFile.of("config", RemoteFileType.DATA, "{\"a\":1}")).text());
  }

  @Test
  void systemModule_isNeitherUnwrappedNorWrapped() {
    String raw = "function CommonJS() { /* runtime */ }";
    RemoteFile remote = RemoteFile.of("CommonJS", RemoteFileType.CODE, raw);

    LocalFile local = transformer.toLocal(remote);
    assertEquals("CommonJS.js", local.relativePath());
    assertEquals(raw, local.text());

    RemoteFile back = transformer.toRemote(local).orElseThrow();
    assertEquals("CommonJS", back.name());
    assertEquals(raw, back.content());
  }

  @Test
  void newLocalCode_isWrappedUnderFlattenedName() {
    LocalFile local = LocalFile.ofText("lib/math.js", "exports.add = (a, b) => a + b;", Instant.EPOCH);

    RemoteFile remote = transformer.toRemote(local).orElseThrow();

    assertEquals("lib_math", remote.name());
    assertEquals(RemoteFileType.CODE, remote.type());
    assertTrue(ModuleShim.isWrapped(remote.content()));
    assertEquals("exports.add = (a, b) => a + b;", ModuleShim.unwrap(remote.content()).body());
  }

  @Test
  void pushBack_keepsPreviousNameAndModuleOptions() {
    ModuleOptions options = new ModuleOptions(true, List.of("MY_FN"));
    RemoteFile previous =
        RemoteFile.of("a_b", RemoteFileType.CODE, ModuleShim.wrap("function MY_FN(){}", options, "a_b"));
    LocalFile edited = LocalFile.ofText("a/b.js", "function MY_FN(){ return 2; }", Instant.EPOCH);

    RemoteFile remote = transformer.toRemote(edited, previous).orElseThrow();

    assertEquals("a_b", remote.name());
    assertEquals(options, ModuleShim.unwrap(remote.content()).options());
  }

  @Test
  void readme_isConvertedBetweenMarkdownAndHtml() {
    LocalFile readme = LocalFile.ofText("README.md", "# Title\n\nSome *text*.\n", Instant.EPOCH);

    RemoteFile remote = transformer.toRemote(readme).orElseThrow();

    assertEquals("README", remote.name());
    assertEquals(RemoteFileType.MARKUP, remote.type());
    assertTrue(remote.content().contains("<h1>Title</h1>"));
    assertTrue(remote.content().contains("content=\"markdown-to-html\""));

    LocalFile back = transformer.toLocal(remote);
    assertEquals("README.md", back.relativePath());
    assertTrue(back.text().startsWith("# Title"));
    assertTrue(back.text().contains("text"));
  }

  @Test
  void nestedReadme_mapsToFolderReadme() {
    RemoteFile remote =
        transformer
            .toRemote(LocalFile.ofText("docs/README.md", "hello\n", Instant.EPOCH))
            .orElseThrow();

    assertEquals("docs_README", remote.name());
    assertEquals("docs/README.md", transformer.localPathFor(remote));
  }

  @Test
  void readmeWithoutMarkdownMarker_isKeptAsHtml() {
    RemoteFile remote = RemoteFile.of("README", RemoteFileType.MARKUP, "<p>hand written</p>");

    assertEquals("<p>hand written</p>", transformer.toLocal(remote).text());
  }

  @Test
  void dotfile_keepsItsName() {
    LocalFile gitignore = LocalFile.ofText(".gitignore", "node_modules/\n", Instant.EPOCH);

    RemoteFile remote = transformer.toRemote(gitignore).orElseThrow();

    assertEquals(".gitignore", remote.name());
    assertEquals(".gitignore", transformer.localPathFor(remote));
    assertEquals("node_modules/\n", transformer.toLocal(remote).text());
  }

  @Test
  void breadcrumb_isMirroredUnderGitGas() {
    String ini = "[remote \"origin\"]\n    url = https://example.com/r.git\n";
    RemoteFile remote = RemoteFile.of(".git/config", RemoteFileType.CODE, ini);

    LocalFile local = transformer.toLocal(remote);

    assertEquals(".git-gas/config", local.relativePath());
    assertEquals(ini, local.text());
    assertEquals(".git/config", transformer.toRemote(local).orElseThrow().name());
  }

  @Test
  void unsupportedLocalFiles_haveNoRemoteForm() {
    assertFalse(transformer.toRemote(LocalFile.ofText("notes.txt", "x", Instant.EPOCH)).isPresent());
    assertFalse(transformer.toRemote(LocalFile.ofText("Makefile", "x", Instant.EPOCH)).isPresent());
    assertFalse(transformer.toRemote(LocalFile.ofText("docs/guide.md", "x", Instant.EPOCH)).isPresent());
    assertFalse(transformer.toRemote(LocalFile.ofText(".git/HEAD", "x", Instant.EPOCH)).isPresent());
  }

  @Test
  void remoteNamesWithEmptySegments_areKeptVerbatim() {
    assertEquals("a/b/c", ContentTransformer.remoteNameToPath("a_b_c"));
    assertEquals("_private", ContentTransformer.remoteNameToPath("_private"));
    assertEquals("a__b", ContentTransformer.remoteNameToPath("a__b"));
    assertEquals("a_b", ContentTransformer.pathToRemoteName("a/b"));
  }
}
