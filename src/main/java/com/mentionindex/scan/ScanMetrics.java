package com.mentionindex.scan;

public record ScanMetrics(
        ScanStrategy strategy,
        double scanTimeMs,
        int matchesFound,
        int lineLength,
        boolean cacheHit
) {
}
