package scriptsync.core.merge;

/** Result of a standalone three-way text merge; {@code conflict} is null when clean. */
public record TextMergeResult(String text, MergeConflict conflict) {
  public boolean isClean() {
    return conflict == null;
  }
}
