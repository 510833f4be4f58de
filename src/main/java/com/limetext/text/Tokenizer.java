package com.limetext.text;

import java.util.List;

public interface Tokenizer {

    /**
     * 将输入文本切分为片段列表。
     */
    List<Token> tokenize(String text);
}
