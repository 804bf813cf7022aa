package com.mentionindex.text;

/**
 * 分词结果中的单个词项。偏移基于原始文本，区间左闭右开。
 *
 * @param term        规范化后的词项文本
 * @param position    词项在序列中的序号
 * @param startOffset 起始字符偏移
 * @param endOffset   结束字符偏移（不含）
 */
public record Token(
    String term,
    int position,
    int startOffset,
    int endOffset
) {
    public Token {
        if (term == null || term.isEmpty()) {
            throw new IllegalArgumentException("词项不能为空");
        }
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("非法偏移区间: [" + startOffset + ", " + endOffset + ")");
        }
    }

    public int length() {
        return endOffset - startOffset;
    }
}
