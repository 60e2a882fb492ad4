package scriptsync.core.merge;

public interface MergeStrategy {
  String name();

  /** Writes remote content into the working copy; conflicted paths are reported, never resolved. */
  MergeOutcome merge(MergeRequest request);
}
