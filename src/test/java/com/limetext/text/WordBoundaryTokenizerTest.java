package com.limetext.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WordBoundaryTokenizerTest {

    private final WordBoundaryTokenizer tokenizer = new WordBoundaryTokenizer();

    @Test
    @DisplayName("词与分隔符交替输出")
    void testAlternatingTokens() {
        List<Token> tokens = tokenizer.tokenize("Hello, world!");

        assertEquals(4, tokens.size());
        assertToken(tokens.get(0), "Hello", 0, 0, 5);
        assertToken(tokens.get(1), ", ", 1, 5, 7);
        assertToken(tokens.get(2), "world", 2, 7, 12);
        assertToken(tokens.get(3), "!", 3, 12, 13);
    }

    @Test
    @DisplayName("开头的分隔符不产生空片段")
    void testLeadingSeparator() {
        List<Token> tokens = tokenizer.tokenize("  hi");

        assertEquals(2, tokens.size());
        assertToken(tokens.get(0), "  ", 0, 0, 2);
        assertToken(tokens.get(1), "hi", 1, 2, 4);
    }

    @Test
    @DisplayName("Unicode 字母与下划线属于词字符")
    void testUnicodeWordCharacters() {
        List<Token> tokens = tokenizer.tokenize("café naïve snake_case");

        assertEquals(5, tokens.size());
        assertEquals("café", tokens.get(0).term());
        assertEquals("naïve", tokens.get(2).term());
        assertEquals("snake_case", tokens.get(4).term());
    }

    @Test
    @DisplayName("撇号拆分单词")
    void testApostropheSplitsWord() {
        List<Token> tokens = tokenizer.tokenize("don't");

        assertEquals(3, tokens.size());
        assertEquals("don", tokens.get(0).term());
        assertEquals("'", tokens.get(1).term());
        assertEquals("t", tokens.get(2).term());
    }

    @Test
    @DisplayName("空输入返回空列表")
    void testEmptyInput() {
        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertTrue(tokenizer.tokenize("").isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "This is a good movie",
        "  leading and trailing  ",
        "...,,,!!!",
        "line1\nline2\r\n\ttabbed",
        "数字 123 与 mixed-CASE 文本。",
        "x"
    })
    @DisplayName("拼接全部片段得到原文")
    void testConcatenationRestoresInput(String text) {
        StringBuilder builder = new StringBuilder();
        int expectedStart = 0;
        for (Token token : tokenizer.tokenize(text)) {
            assertEquals(expectedStart, token.startOffset());
            assertEquals(token.term().length(), token.length());
            assertFalse(token.term().isEmpty());
            builder.append(token.term());
            expectedStart = token.endOffset();
        }
        assertEquals(text, builder.toString());
    }

    @Test
    @DisplayName("非词判断")
    void testIsNonWord() {
        assertTrue(WordBoundaryTokenizer.isNonWord(", "));
        assertTrue(WordBoundaryTokenizer.isNonWord("\n\t"));
        assertFalse(WordBoundaryTokenizer.isNonWord("good"));
        assertFalse(WordBoundaryTokenizer.isNonWord("42"));
    }

    private void assertToken(Token token, String term, int position, int startOffset, int endOffset) {
        assertEquals(term, token.term());
        assertEquals(position, token.position());
        assertEquals(startOffset, token.startOffset());
        assertEquals(endOffset, token.endOffset());
    }
}
