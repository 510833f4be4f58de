package com.limetext.text;

/**
 * 原文中的一个片段：词或分隔符，term 保留原始大小写与空白。
 */
public record Token(
    String term,
    int position,
    int startOffset,
    int endOffset
) {

    public int length() {
        return endOffset - startOffset;
    }
}
