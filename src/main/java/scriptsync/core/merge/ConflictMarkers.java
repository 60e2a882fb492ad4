package scriptsync.core.merge;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Reads inline conflict markers, both the plain and the diff3 style. */
public final class ConflictMarkers {
  private static final Pattern ANY_MARKER = Pattern.compile("(?m)^(<{7}|>{7})( .*)?$");

  private ConflictMarkers() {}

  public static boolean containsMarkers(String text) {
    return text != null && ANY_MARKER.matcher(text).find();
  }

  public static MergeConflict parse(String path, String text) {
    List<ConflictSpan> spans = new ArrayList<>();
    if (text == null) {
      return new MergeConflict(path, spans);
    }

    StringBuilder local = null;
    StringBuilder base = null;
    StringBuilder remote = null;
    StringBuilder current = null;
    for (String line : text.split("\n", -1)) {
      if (line.startsWith("<<<<<<<")) {
        local = new StringBuilder();
        base = null;
        remote = null;
        current = local;
      } else if (local != null && line.startsWith("|||||||")) {
        base = new StringBuilder();
        current = base;
      } else if (local != null && line.startsWith("=======")) {
        remote = new StringBuilder();
        current = remote;
      } else if (local != null && remote != null && line.startsWith(">>>>>>>")) {
        spans.add(
            new ConflictSpan(
                local.toString(), base == null ? null : base.toString(), remote.toString()));
        local = null;
        current = null;
      } else if (current != null) {
        current.append(line).append('\n');
      }
    }
    return new MergeConflict(path, spans);
  }
}
