package com.mentionindex.mention;

import java.time.Instant;

/**
 * 最近一次全量扫描的统计。
 *
 * @param lastFullScan 尚未执行全量扫描时为 null
 */
public record MentionCountingStats(
        int totalFilesScanned,
        int totalMentionsFound,
        int filesWithMentions,
        Instant lastFullScan,
        double averageScanTimeMs
) {

    public static final MentionCountingStats EMPTY = new MentionCountingStats(0, 0, 0, null, 0.0);
}
