package com.mentionindex.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一个规范化姓名的提及计数快照。
 */
public record MentionCount(
        String canonicalName,
        String fullName,
        int totalMentions,
        int textMentions,
        int taskMentions,
        Instant lastUpdated,
        Map<String, FileMentionCount> mentionsByDocument
) {

    public MentionCount {
        mentionsByDocument = Collections.unmodifiableMap(new LinkedHashMap<>(mentionsByDocument));
    }
}
