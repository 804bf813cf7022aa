package com.mentionindex.text;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 姓名规范化：去首尾空白、合并连续空白、转小写。
 */
public final class NameNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NameNormalizer() {
    }

    /**
     * @throws NullPointerException 输入为 null
     */
    public static String normalize(String text) {
        Objects.requireNonNull(text, "text");
        return collapseWhitespace(text).toLowerCase(Locale.ROOT);
    }

    /**
     * 只合并空白、保留大小写。行内匹配用这一形式，小写化可能改变字符串长度。
     */
    public static String collapseWhitespace(String text) {
        Objects.requireNonNull(text, "text");
        return WHITESPACE.matcher(text.strip()).replaceAll(" ");
    }
}
