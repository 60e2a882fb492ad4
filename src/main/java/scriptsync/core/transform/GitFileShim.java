package scriptsync.core.transform;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;

/**
 * Files under a remote {@code .git/} folder are stored as a code module carrying the native git
 * text in a JSON string literal named {@code RAW_CONTENT}.
 */
public class GitFileShim {
  private static final String RAW_CONTENT = "const RAW_CONTENT = ";

  private final ObjectMapper objectMapper;

  public GitFileShim(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String wrap(String text, String gitPath) {
    String literal;
    try {
      literal = objectMapper.writeValueAsString(text == null ? "" : text);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode git file: " + gitPath, e);
    }
    return "function _main(\n"
        + "  module = globalThis.__getCurrentModule(),\n"
        + "  exports = module.exports,\n"
        + "  require = globalThis.require\n"
        + ") {\n"
        + "  // Git file: " + gitPath + "\n"
        + "  " + RAW_CONTENT + literal + ";\n"
        + "\n"
        + "  module.exports = {\n"
        + "    raw: RAW_CONTENT,\n"
        + "    format: 'ini',\n"
        + "    gitPath: '" + gitPath + "'\n"
        + "  };\n"
        + "}\n"
        + "\n"
        + "__defineModule__(_main);";
  }

  /** Native git text; plain (unshimmed) content is returned as-is. */
  public String unwrap(String content) {
    if (content == null) {
      return "";
    }
    int start = content.indexOf(RAW_CONTENT);
    if (start < 0) {
      return content;
    }
    try (JsonParser parser =
        objectMapper.getFactory().createParser(content.substring(start + RAW_CONTENT.length()))) {
      if (parser.nextToken() == JsonToken.VALUE_STRING) {
        return parser.getText();
      }
      throw new IllegalArgumentException("RAW_CONTENT is not a string literal.");
    } catch (IOException e) {
      throw new IllegalArgumentException("Malformed git file module: " + e.getMessage(), e);
    }
  }
}
