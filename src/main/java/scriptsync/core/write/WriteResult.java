package scriptsync.core.write;

import java.time.Instant;

/**
 * Outcome of a committed transaction. {@code commitHash} is null when the local tree already held
 * the content; {@code hookModified} tells whether hooks changed the content before it was pushed.
 */
public record WriteResult(
    String path,
    String remoteName,
    String commitHash,
    boolean hookModified,
    Instant remoteUpdateTime) {}
