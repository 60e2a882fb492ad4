package scriptsync.core.git;

public enum ApplyOutcome {
  APPLIED,
  /** The patch was applied but left conflicted index entries behind. */
  APPLIED_WITH_CONFLICTS,
  REJECTED
}
