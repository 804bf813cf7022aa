package com.mentionindex.text;

import java.util.List;

public interface Tokenizer {

    /**
     * 将输入文本切分为词项列表。
     */
    List<Token> tokenize(String text);

    /**
     * 只取词项文本。
     */
    default List<String> terms(String text) {
        return tokenize(text).stream().map(Token::term).toList();
    }
}
