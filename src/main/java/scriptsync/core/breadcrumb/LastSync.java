package scriptsync.core.breadcrumb;

import java.time.Instant;

public record LastSync(Instant timestamp, String direction, int filesChanged) {}
