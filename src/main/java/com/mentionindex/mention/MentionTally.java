package com.mentionindex.mention;

import com.mentionindex.model.FileMentionCount;
import com.mentionindex.model.MentionCount;
import com.mentionindex.model.MentionType;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一个规范化姓名的可变计数桶，只在计数器内部使用，对外发布 {@link MentionCount} 快照。
 */
final class MentionTally {

    private final String canonicalName;
    private final String fullName;
    private final Map<String, DocumentTally> byDocument = new LinkedHashMap<>();
    private int textMentions;
    private int taskMentions;
    private Instant lastUpdated;

    MentionTally(String canonicalName, String fullName, Instant createdAt) {
        this.canonicalName = canonicalName;
        this.fullName = fullName;
        this.lastUpdated = createdAt;
    }

    void add(String documentId, MentionType type, Instant at) {
        DocumentTally document = byDocument.computeIfAbsent(documentId, id -> new DocumentTally());
        if (type == MentionType.TASK) {
            taskMentions++;
            document.task++;
        } else {
            textMentions++;
            document.text++;
        }
        document.lastScanned = at;
        lastUpdated = at;
    }

    /**
     * 扣除某文档此前的全部贡献。
     */
    void removeDocument(String documentId, Instant at) {
        DocumentTally previous = byDocument.remove(documentId);
        if (previous != null) {
            textMentions -= previous.text;
            taskMentions -= previous.task;
            lastUpdated = at;
        }
    }

    int total() {
        return textMentions + taskMentions;
    }

    MentionCount snapshot() {
        Map<String, FileMentionCount> documents = new LinkedHashMap<>();
        byDocument.forEach((id, tally) ->
            documents.put(id, new FileMentionCount(id, tally.text, tally.task, tally.lastScanned)));
        return new MentionCount(canonicalName, fullName, total(), textMentions, taskMentions, lastUpdated, documents);
    }

    private static final class DocumentTally {
        private int text;
        private int task;
        private Instant lastScanned;
    }
}
