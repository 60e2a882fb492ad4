package scriptsync.core.remote;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Content kind of a remote file. The wire names are the ones the remote store speaks. */
public enum RemoteFileType {
  CODE("SERVER_JS", ".js"),
  MARKUP("HTML", ".html"),
  DATA("JSON", ".json");

  private final String wireName;
  private final String localExtension;

  RemoteFileType(String wireName, String localExtension) {
    this.wireName = wireName;
    this.localExtension = localExtension;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public String localExtension() {
    return localExtension;
  }

  @JsonCreator
  public static RemoteFileType fromWire(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Remote file type must be non-blank.");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (RemoteFileType type : values()) {
      if (type.wireName.equals(normalized) || type.name().equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unsupported remote file type: " + value);
  }
}
