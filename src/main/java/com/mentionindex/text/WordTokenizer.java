package com.mentionindex.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 按空白切分的小写分词器，保留连字符、撇号等词内符号。
 */
public class WordTokenizer implements Tokenizer {

    /**
     * 对文本按空白分词，并输出原文偏移。
     */
    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        int index = 0;
        while (index < text.length()) {
            if (Character.isWhitespace(text.charAt(index))) {
                index++;
                continue;
            }
            int wordStart = index;
            while (index < text.length() && !Character.isWhitespace(text.charAt(index))) {
                index++;
            }
            String term = text.substring(wordStart, index).toLowerCase(Locale.ROOT);
            tokens.add(new Token(term, tokens.size(), wordStart, index));
        }
        return List.copyOf(tokens);
    }
}
