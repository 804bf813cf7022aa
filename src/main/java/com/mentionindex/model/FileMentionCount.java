package com.mentionindex.model;

import java.time.Instant;

public record FileMentionCount(
        String documentId,
        int textMentions,
        int taskMentions,
        Instant lastScanned
) {

    public int totalMentions() {
        return textMentions + taskMentions;
    }
}
