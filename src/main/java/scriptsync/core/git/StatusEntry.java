package scriptsync.core.git;

import java.util.Set;

/** One line of {@code git status --porcelain}. */
public record StatusEntry(String code, String path) {
  private static final Set<String> CONFLICT_CODES = Set.of("UU", "AA", "DD", "AU", "UA", "DU", "UD");

  public boolean isConflict() {
    return CONFLICT_CODES.contains(code);
  }
}
