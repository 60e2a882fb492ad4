package scriptsync.core.merge;

/** One conflicted hunk. {@code base} is null when the markers carry no base section. */
public record ConflictSpan(String local, String base, String remote) {}
