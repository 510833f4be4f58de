package com.limetext.explain;

/**
 * 原文中的一段高亮区间 [start, end) 及其权重。
 */
public record HighlightSpan(int start, int end, int featureId, double weight) {
}
