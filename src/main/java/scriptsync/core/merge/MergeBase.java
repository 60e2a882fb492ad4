package scriptsync.core.merge;

/** Which version of a file serves as the common ancestor of a merge. */
public enum MergeBase {
  /**
   * The local file as it is right before the merge. The remote side always wins a divergence; no
   * conflict can arise.
   */
  LOCAL_SNAPSHOT,
  /**
   * The file as of the commit that was {@code HEAD} before the pre-merge snapshot, normally the
   * last sync. Overlapping local and remote edits conflict.
   */
  LAST_COMMIT
}
