package com.mentionindex.text;

import com.mentionindex.config.Constants;

/**
 * 类 soundex 的模糊键：去元音、合并连续重复字符、截断或填充到固定长度。
 */
public final class FuzzyKey {

    private FuzzyKey() {
    }

    /**
     * 输入应为已规范化的小写文本。
     */
    public static String of(String normalizedText) {
        StringBuilder key = new StringBuilder(Constants.FUZZY_KEY_LENGTH);
        char previous = 0;
        boolean hasPrevious = false;
        for (int index = 0; index < normalizedText.length() && key.length() < Constants.FUZZY_KEY_LENGTH; index++) {
            char current = normalizedText.charAt(index);
            if (isVowel(current)) {
                continue;
            }
            if (hasPrevious && current == previous) {
                continue;
            }
            key.append(current);
            previous = current;
            hasPrevious = true;
        }
        while (key.length() < Constants.FUZZY_KEY_LENGTH) {
            key.append(Constants.FUZZY_KEY_FILLER);
        }
        return key.toString();
    }

    private static boolean isVowel(char ch) {
        return ch == 'a' || ch == 'e' || ch == 'i' || ch == 'o' || ch == 'u';
    }
}
