package com.mentionindex.text;

import java.util.ArrayList;
import java.util.List;

/**
 * 对整段文本做字符级双字切分，空格也参与切分。
 */
public class CharBigramTokenizer implements Tokenizer {

    /**
     * 长度不足 2 的文本不产生任何词项。
     */
    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.length() < 2) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>(text.length() - 1);
        for (int index = 0; index < text.length() - 1; index++) {
            String bigramTerm = text.substring(index, index + 2);
            tokens.add(new Token(bigramTerm, index, index, index + 2));
        }
        return List.copyOf(tokens);
    }
}
