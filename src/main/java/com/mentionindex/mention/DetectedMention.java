package com.mentionindex.mention;

import com.mentionindex.model.MentionType;
import com.mentionindex.scan.Mention;

/**
 * 带行类型的提及。
 */
public record DetectedMention(Mention mention, MentionType type) {

    public String canonicalName() {
        return mention.canonicalName();
    }
}
