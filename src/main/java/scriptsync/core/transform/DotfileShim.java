package scriptsync.core.transform;

/**
 * Dotfiles such as {@code .gitignore} are stored remotely as a code module that exports the raw
 * text as an escaped template string.
 */
public final class DotfileShim {
  private static final String CONTENT_START = "const content = `";
  private static final String DOTFILE_MARKER = "type: 'dotfile'";

  private DotfileShim() {}

  public static String wrap(String text, String filename) {
    return "function _main(\n"
        + "  module = globalThis.__getCurrentModule(),\n"
        + "  exports = module.exports,\n"
        + "  require = globalThis.require\n"
        + ") {\n"
        + "  // Original file: " + filename + "\n"
        + "  " + CONTENT_START + escape(text == null ? "" : text) + "`;\n"
        + "\n"
        + "  module.exports = {\n"
        + "    filename: '" + filename + "',\n"
        + "    " + DOTFILE_MARKER + ",\n"
        + "    content: content\n"
        + "  };\n"
        + "}\n"
        + "\n"
        + "__defineModule__(_main);";
  }

  /** Extracts the raw text, or returns the content unchanged when it is not a dotfile module. */
  public static String unwrap(String content) {
    if (content == null) {
      return "";
    }
    int start = content.indexOf(CONTENT_START);
    if (start < 0 || !content.contains(DOTFILE_MARKER)) {
      return content;
    }

    StringBuilder text = new StringBuilder();
    for (int i = start + CONTENT_START.length(); i < content.length(); i++) {
      char c = content.charAt(i);
      if (c == '\\' && i + 1 < content.length()) {
        text.append(content.charAt(++i));
      } else if (c == '`') {
        return text.toString();
      } else {
        text.append(c);
      }
    }
    return content;
  }

  private static String escape(String text) {
    StringBuilder out = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\\' || c == '`' || c == '$') {
        out.append('\\');
      }
      out.append(c);
    }
    return out.toString();
  }
}
