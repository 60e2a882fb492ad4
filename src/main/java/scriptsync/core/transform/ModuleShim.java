package scriptsync.core.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wraps plain script code into the remote module format and back.
 *
 * <pre>
 * function _main(
 *   module = globalThis.__getCurrentModule(),
 *   exports = module.exports,
 *   require = globalThis.require
 * ) {
 *   ...body, indented by two spaces...
 * }
 *
 * __defineModule__(_main);
 * </pre>
 */
public final class ModuleShim {
  static final String HOISTED_START = "// ===== HOISTED CUSTOM FUNCTIONS =====";
  static final String HOISTED_END = "// ===== END HOISTED CUSTOM FUNCTIONS =====";

  private static final String HEADER =
      "function _main(\n"
          + "  module = globalThis.__getCurrentModule(),\n"
          + "  exports = module.exports,\n"
          + "  require = globalThis.require\n"
          + ") {\n";

  // Runtime files of the remote platform are stored unwrapped.
  private static final Set<String> SYSTEM_MODULES = Set.of("appsscript", "CommonJS", "__mcp_gas_run");

  private static final Pattern MAIN_START = Pattern.compile("(?m)^\\s*function\\s+_main\\s*\\(");
  private static final Pattern DEFINE_CALL =
      Pattern.compile("__defineModule__\\(\\s*_main\\s*(,[^;]*)?\\)\\s*;?\\s*$");
  private static final Pattern LOAD_NOW_ARG =
      Pattern.compile("^,\\s*(true|null\\s*,\\s*\\{[^}]*loadNow\\s*:\\s*true[^}]*\\})\\s*$");
  private static final Pattern HOISTED_DECL =
      Pattern.compile("(?m)^\\s*function\\s+([A-Za-z_$][\\w$]*)\\s*\\(");

  private ModuleShim() {}

  public static boolean isSystemModule(String remoteName) {
    return remoteName != null && SYSTEM_MODULES.contains(remoteName);
  }

  public static boolean isWrapped(String content) {
    return content != null && MAIN_START.matcher(content).find() && content.contains("__defineModule__");
  }

  public static String wrap(String body, ModuleOptions options, String moduleName) {
    String trimmed = body == null ? "" : body.strip();
    if (isWrapped(trimmed)) {
      return trimmed;
    }
    ModuleOptions effective = options == null ? ModuleOptions.NONE : options;

    StringBuilder out = new StringBuilder(HEADER);
    if (!trimmed.isEmpty()) {
      for (String line : trimmed.split("\n", -1)) {
        out.append(line.isEmpty() ? "" : "  " + line).append('\n');
      }
    }
    out.append("}\n\n");

    if (!effective.hoistedFunctions().isEmpty()) {
      out.append(HOISTED_START).append('\n');
      for (String name : effective.hoistedFunctions()) {
        out.append("function ")
            .append(name)
            .append("(...args) {\n  return require('")
            .append(moduleName)
            .append("').")
            .append(name)
            .append("(...args);\n}\n");
      }
      out.append(HOISTED_END).append("\n\n");
    }

    out.append(effective.loadNow() ? "__defineModule__(_main, true);" : "__defineModule__(_main);");
    return out.toString();
  }

  /** Returns the module body and its options; content without a shim is returned unchanged. */
  public static Unwrapped unwrap(String content) {
    String source = content == null ? "" : content.replace("\r\n", "\n");
    Matcher start = MAIN_START.matcher(source);
    if (!start.find()) {
      return new Unwrapped(source, ModuleOptions.NONE);
    }

    int bodyStart = source.indexOf(") {", start.end());
    if (bodyStart < 0) {
      return new Unwrapped(source, ModuleOptions.NONE);
    }
    bodyStart = source.indexOf('\n', bodyStart);
    if (bodyStart < 0) {
      return new Unwrapped(source, ModuleOptions.NONE);
    }

    Matcher define = DEFINE_CALL.matcher(source);
    boolean hasDefine = define.find(bodyStart);
    int tailStart = hasDefine ? define.start() : source.length();
    boolean loadNow = hasDefine && isLoadNow(define);

    int hoistedStart = source.indexOf(HOISTED_START, bodyStart);
    int boundary = hoistedStart >= 0 && hoistedStart < tailStart ? hoistedStart : tailStart;
    int bodyEnd = source.lastIndexOf("\n}", boundary);
    if (bodyEnd < bodyStart) {
      return new Unwrapped(source, ModuleOptions.NONE);
    }

    List<String> hoisted = new ArrayList<>();
    if (hoistedStart >= 0 && hoistedStart < tailStart) {
      Matcher decl = HOISTED_DECL.matcher(source.substring(hoistedStart, tailStart));
      while (decl.find()) {
        hoisted.add(decl.group(1));
      }
    }

    String inner = bodyEnd > bodyStart ? source.substring(bodyStart + 1, bodyEnd) : "";
    StringBuilder body = new StringBuilder();
    for (String line : inner.split("\n", -1)) {
      body.append(line.startsWith("  ") ? line.substring(2) : line).append('\n');
    }
    return new Unwrapped(body.toString().strip(), new ModuleOptions(loadNow, hoisted));
  }

  private static boolean isLoadNow(Matcher define) {
    String args = define.group(1);
    return args != null && LOAD_NOW_ARG.matcher(args).matches();
  }

  public record Unwrapped(String body, ModuleOptions options) {}
}
