package com.limetext.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class WordBoundaryTokenizer implements Tokenizer {

    /** 非词字符的最大连续片段，按 Unicode 语义匹配 */
    public static final Pattern NON_WORD_PATTERN = Pattern.compile("\\W+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * 按词边界切分，词与分隔符交替输出，拼接全部片段即得到原文。
     */
    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        Matcher delimiterMatcher = NON_WORD_PATTERN.matcher(text);
        int segmentStart = 0;

        while (delimiterMatcher.find()) {
            appendToken(text, segmentStart, delimiterMatcher.start(), tokens);
            appendToken(text, delimiterMatcher.start(), delimiterMatcher.end(), tokens);
            segmentStart = delimiterMatcher.end();
        }
        appendToken(text, segmentStart, text.length(), tokens);

        return List.copyOf(tokens);
    }

    /**
     * 判断片段是否完全由非词字符组成。
     */
    public static boolean isNonWord(String term) {
        return NON_WORD_PATTERN.matcher(term).matches();
    }

    private void appendToken(String sourceText, int startOffset, int endOffset, List<Token> tokens) {
        // 文本首尾的分隔符会产生空片段，直接跳过
        if (startOffset >= endOffset) {
            return;
        }
        tokens.add(new Token(sourceText.substring(startOffset, endOffset), tokens.size(), startOffset, endOffset));
    }
}
