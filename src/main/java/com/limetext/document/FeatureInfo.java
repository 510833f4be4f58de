package com.limetext.document;

/**
 * 单个特征的展示信息：编号、原文词与所有出现的字符偏移。
 */
public record FeatureInfo(int id, String text, int[] positions) {
}
