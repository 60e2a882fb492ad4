package scriptsync.core.write;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class WriteFileCommandTest {

  @Test
  void path_isNormalized() {
    assertEquals("x.js", command("./x.js").path());
    assertEquals("x.js", command("a/../x.js").path());
    assertEquals("src/x.js", command("/src//./x.js").path());
    assertEquals("src/x.js", command("src\\x.js").path());
  }

  @Test
  void pathEscapingTheSyncFolder_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> command("../x.js"));
    assertThrows(IllegalArgumentException.class, () -> command("a/../../x.js"));
  }

  @Test
  void pathIntoGitDirectory_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> command(".git/config"));
    assertThrows(IllegalArgumentException.class, () -> command("./.git/hooks/pre-commit"));
  }

  @Test
  void pathWithoutFileName_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> command("./"));
    assertThrows(IllegalArgumentException.class, () -> command("a/.."));
  }

  private static WriteFileCommand command(String path) {
    return new WriteFileCommand("p1", null, path, "x", null);
  }
}
