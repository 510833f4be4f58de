package com.limetext.sampling;

import java.util.List;

/**
 * 尚未经过分类器的扰动结果。
 *
 * @param data      样本数 × 特征数 的 0/1 矩阵，第 0 行全为 1
 * @param texts     每行掩码对应的重建文本
 * @param distances 每行与原文的余弦距离（已乘以缩放系数）
 */
public record Perturbations(
    double[][] data,
    List<String> texts,
    double[] distances
) {

    public int size() {
        return data.length;
    }
}
