package com.lunaindex.staleness;

import java.time.Instant;

public record StalenessRecord(
        String file,
        Instant summaryTimestamp,
        Instant fileLastModified,
        boolean stale,
        String reason) {
}
