package com.mentionindex.scan;

import java.util.ArrayList;
import java.util.List;

/**
 * 整词、大小写不敏感的子串查找。字母与数字视为词内字符。
 */
public final class WordBoundaries {

    private WordBoundaries() {
    }

    public static boolean isWordChar(char ch) {
        return Character.isLetterOrDigit(ch);
    }

    /**
     * {@code [start, end)} 两侧均为非词字符或行边界。
     */
    public static boolean isWholeWord(String text, int start, int end) {
        if (start > 0 && isWordChar(text.charAt(start - 1))) {
            return false;
        }
        return end >= text.length() || !isWordChar(text.charAt(end));
    }

    /**
     * 在 {@code start} 处是否出现整词 {@code name}。
     */
    public static boolean matchesAt(String text, int start, String name) {
        int end = start + name.length();
        return end <= text.length()
                && text.regionMatches(true, start, name, 0, name.length())
                && isWholeWord(text, start, end);
    }

    /**
     * 返回所有整词出现的起始位置，出现之间允许重叠。
     */
    public static List<Integer> findAll(String text, String name) {
        if (name.isEmpty() || name.length() > text.length()) {
            return List.of();
        }
        List<Integer> starts = new ArrayList<>();
        for (int start = 0; start + name.length() <= text.length(); start++) {
            if (matchesAt(text, start, name)) {
                starts.add(start);
            }
        }
        return starts;
    }

    /**
     * 是否为一个词的起始字符。
     */
    static boolean isWordStart(String text, int index) {
        return isWordChar(text.charAt(index)) && (index == 0 || !isWordChar(text.charAt(index - 1)));
    }

    /**
     * 从词起始位置向后找到词尾（不含）。
     */
    static int wordEnd(String text, int start) {
        int end = start;
        while (end < text.length() && isWordChar(text.charAt(end))) {
            end++;
        }
        return end;
    }
}
