package scriptsync.core.write;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A single-file change. {@code path} is relative to the sub-tree's sync folder and uses local
 * naming ({@code utils.js}, {@code README.md}); {@code content} is the local form. The path is
 * normalized on construction, so {@code ./a/../utils.js} and {@code utils.js} name the same file.
 */
public record WriteFileCommand(
    String projectId, String subtreePath, String path, String content, String changeReason) {
  public WriteFileCommand {
    if (projectId == null || projectId.isBlank()) {
      throw new IllegalArgumentException("projectId must be non-blank.");
    }
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("path must be non-blank.");
    }
    projectId = projectId.trim();
    path = normalizePath(path);
    subtreePath = subtreePath == null ? "" : subtreePath;
  }

  static String normalizePath(String rawPath) {
    Deque<String> segments = new ArrayDeque<>();
    for (String segment : rawPath.trim().replace('\\', '/').split("/")) {
      if (segment.isEmpty() || segment.equals(".")) {
        continue;
      }
      if (segment.equals("..")) {
        if (segments.isEmpty()) {
          throw new IllegalArgumentException("path escapes the sync folder: " + rawPath);
        }
        segments.removeLast();
      } else {
        segments.addLast(segment);
      }
    }
    if (segments.isEmpty()) {
      throw new IllegalArgumentException("path must name a file: " + rawPath);
    }
    if (segments.getFirst().equals(".git")) {
      throw new IllegalArgumentException("path must not point into .git: " + rawPath);
    }
    return String.join("/", segments);
  }
}
