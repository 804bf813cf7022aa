package com.mentionindex.scan;

import com.mentionindex.model.PersonRecord;

/**
 * 行内一次姓名出现。{@code start} 含、{@code end} 不含。
 */
public record Mention(
        PersonRecord person,
        int start,
        int end,
        String matchedText,
        ScanStrategy strategy
) {

    public String canonicalName() {
        return person.canonicalName();
    }
}
