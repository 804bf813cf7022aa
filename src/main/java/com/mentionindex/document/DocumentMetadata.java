package com.mentionindex.document;

import java.util.Map;

/**
 * 文档派生元数据。
 *
 * @param frontmatter          frontmatter 键值，无 frontmatter 时为空表
 * @param frontmatterEndOffset 闭合分隔行末尾的字符偏移，无 frontmatter 时为 -1
 * @param frontmatterLineCount frontmatter 占用的行数（含两条分隔行）
 */
public record DocumentMetadata(
        Map<String, Object> frontmatter,
        int frontmatterEndOffset,
        int frontmatterLineCount
) {

    public static final DocumentMetadata EMPTY = new DocumentMetadata(Map.of(), -1, 0);

    public boolean hasFrontmatter() {
        return frontmatterEndOffset >= 0;
    }

    /**
     * 取字符串类型的 frontmatter 值，其他类型视为缺失。
     */
    public String stringValue(String key) {
        Object value = frontmatter.get(key);
        return value instanceof String text ? text : null;
    }
}
