package scriptsync.core.sync;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Every direction pulls and merges first; {@code PUSH_ONLY} differs from {@code SYNC} only in how
 * the run is recorded. A blind push is never performed.
 */
public enum SyncDirection {
  SYNC("sync"),
  PULL_ONLY("pull-only"),
  PUSH_ONLY("push-only");

  private final String key;

  SyncDirection(String key) {
    this.key = key;
  }

  @JsonValue
  public String key() {
    return key;
  }

  public boolean pushes() {
    return this != PULL_ONLY;
  }

  @JsonCreator
  public static SyncDirection fromJson(String value) {
    if (value == null || value.isBlank()) {
      return SYNC;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (SyncDirection direction : values()) {
      if (direction.key.equals(normalized)) {
        return direction;
      }
    }
    throw new IllegalArgumentException("Invalid sync direction: " + value);
  }
}
