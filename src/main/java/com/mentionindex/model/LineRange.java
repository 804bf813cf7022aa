package com.mentionindex.model;

/**
 * 源文档中的闭区间行号范围，用于原地替换。
 */
public record LineRange(int from, int to) {

    public LineRange {
        if (from < 0 || to < from) {
            throw new IllegalArgumentException("非法行范围: [" + from + ", " + to + "]");
        }
    }

    public LineRange shift(int offset) {
        return new LineRange(from + offset, to + offset);
    }

    public int lineCount() {
        return to - from + 1;
    }
}
