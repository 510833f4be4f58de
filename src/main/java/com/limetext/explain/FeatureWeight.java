package com.limetext.explain;

/**
 * 特征编号及其在局部线性模型中的权重。
 */
public record FeatureWeight(int featureId, double weight) {
}
