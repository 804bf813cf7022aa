package com.mentionindex.scan;

import java.util.Map;

public record ScanSummary(
        double averageScanTimeMs,
        double cacheHitRate,
        Map<ScanStrategy, Integer> strategyCounts
) {
}
