package scriptsync.core.breadcrumb;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal git-config reader and writer. Sections are keyed as {@code name} or
 * {@code name "sub"}; insertion order is kept so rewrites leave unknown entries in place.
 */
public class IniConfig {
  private final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

  public static IniConfig parse(String text) {
    IniConfig config = new IniConfig();
    if (text == null) {
      return config;
    }

    Map<String, String> current = null;
    for (String rawLine : text.split("\r?\n")) {
      String line = rawLine.strip();
      if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
        continue;
      }
      if (line.startsWith("[") && line.endsWith("]")) {
        current = config.section(normalizeHeader(line.substring(1, line.length() - 1)));
        continue;
      }
      if (current == null) {
        continue;
      }
      int eq = line.indexOf('=');
      if (eq < 0) {
        // bare key, git treats it as true
        current.put(line, "true");
      } else {
        current.put(line.substring(0, eq).strip(), unquote(line.substring(eq + 1).strip()));
      }
    }
    return config;
  }

  public Optional<String> get(String section, String key) {
    Map<String, String> values = sections.get(section);
    return values == null ? Optional.empty() : Optional.ofNullable(values.get(key));
  }

  public void set(String section, String key, String value) {
    if (value == null) {
      Map<String, String> values = sections.get(section);
      if (values != null) {
        values.remove(key);
      }
      return;
    }
    section(section).put(key, value);
  }

  /** First subsection name of {@code name}, e.g. the branch of {@code [branch "main"]}. */
  public Optional<String> firstSubsection(String name) {
    String prefix = name + " \"";
    return sections.keySet().stream()
        .filter(key -> key.startsWith(prefix) && key.endsWith("\""))
        .map(key -> key.substring(prefix.length(), key.length() - 1))
        .findFirst();
  }

  public boolean hasSection(String section) {
    return sections.containsKey(section);
  }

  public String render() {
    StringBuilder out = new StringBuilder();
    for (Map.Entry<String, Map<String, String>> section : sections.entrySet()) {
      out.append('[').append(section.getKey()).append("]\n");
      for (Map.Entry<String, String> entry : section.getValue().entrySet()) {
        out.append("    ").append(entry.getKey()).append(" = ").append(quoteIfNeeded(entry.getValue()));
        out.append('\n');
      }
    }
    return out.toString();
  }

  private Map<String, String> section(String name) {
    return sections.computeIfAbsent(name, ignored -> new LinkedHashMap<>());
  }

  private static String normalizeHeader(String header) {
    String trimmed = header.strip();
    int quote = trimmed.indexOf('"');
    if (quote < 0) {
      return trimmed;
    }
    String name = trimmed.substring(0, quote).strip();
    String sub = unquote(trimmed.substring(quote).strip());
    return name + " \"" + sub + "\"";
  }

  private static String unquote(String value) {
    if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
      return value.substring(1, value.length() - 1).replace("\\\"", "\"").replace("\\\\", "\\");
    }
    return value;
  }

  private static String quoteIfNeeded(String value) {
    if (value.isEmpty() || value.contains("#") || value.contains(";") || !value.equals(value.strip())) {
      return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
    return value;
  }
}
