package scriptsync.core.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class DotfileShimTest {
  @Test
  void dotfileText_survivesBackticksDollarsAndBackslashes() {
    String text = "node_modules/\n# `quoted` ${notATemplate}\npath\\with\\slashes\n";

    String wrapped = DotfileShim.wrap(text, ".gitignore");

    assertTrue(wrapped.contains("type: 'dotfile'"));
    assertTrue(wrapped.contains("\\`quoted\\` \\${notATemplate}"));
    assertEquals(text, DotfileShim.unwrap(wrapped));
  }

  @Test
  void unwrap_returnsForeignContentUnchanged() {
    assertEquals("just text", DotfileShim.unwrap("just text"));
  }

  @Test
  void gitFileShim_encodesRawContentAsJsonString() {
    GitFileShim shim = new GitFileShim(new ObjectMapper());
    String ini = "[remote \"origin\"]\n    url = https://example.com/repo.git\n";

    String wrapped = shim.wrap(ini, ".git/config");

    assertTrue(wrapped.contains("const RAW_CONTENT = \"[remote \\\"origin\\\"]\\n"));
    assertTrue(wrapped.contains("gitPath: '.git/config'"));
    assertEquals(ini, shim.unwrap(wrapped));
    assertEquals(ini, shim.unwrap(ini));
  }
}
