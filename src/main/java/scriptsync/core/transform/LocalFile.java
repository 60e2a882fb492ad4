package scriptsync.core.transform;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/** A file under a local sync folder. {@code relativePath} always uses {@code /}. */
public record LocalFile(String relativePath, byte[] content, Instant modTime) {
  public LocalFile {
    if (relativePath == null || relativePath.isBlank()) {
      throw new IllegalArgumentException("relativePath must be non-blank.");
    }
    content = content == null ? new byte[0] : content;
  }

  public static LocalFile ofText(String relativePath, String text, Instant modTime) {
    return new LocalFile(
        relativePath, (text == null ? "" : text).getBytes(StandardCharsets.UTF_8), modTime);
  }

  public String text() {
    return new String(content, StandardCharsets.UTF_8);
  }
}
