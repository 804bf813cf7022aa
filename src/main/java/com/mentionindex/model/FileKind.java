package com.mentionindex.model;

import java.util.Locale;
import java.util.Optional;

public enum FileKind {
    /** 每个文档一个人员 */
    ATOMIC,
    /** 每个文档多个以分隔行隔开的人员块 */
    CONSOLIDATED;

    /**
     * 解析 frontmatter 中的类型标记，大小写不敏感。
     */
    public static Optional<FileKind> fromMarker(Object marker) {
        if (!(marker instanceof String text)) {
            return Optional.empty();
        }
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "atomic" -> Optional.of(ATOMIC);
            case "consolidated" -> Optional.of(CONSOLIDATED);
            default -> Optional.empty();
        };
    }
}
