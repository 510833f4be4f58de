package com.limetext.explain;

import java.util.List;

/**
 * 局部代理模型拟合器，由调用方提供实现。
 */
public interface SurrogateFitter {

    /**
     * 在邻域数据上为单个标签拟合加权线性模型。
     *
     * @param data             样本数 × 特征数 的 0/1 矩阵，第 0 行为原文
     * @param predictions      样本数 × 类别数 的分类器输出
     * @param distances        每行与原文的距离
     * @param label            目标类别下标
     * @param numFeatures      最多返回的特征数
     * @param featureSelection 特征选择方式
     * @return 按重要性排序的 (特征编号, 权重) 列表，长度不超过 numFeatures
     */
    List<FeatureWeight> explainInstanceWithData(double[][] data,
                                                double[][] predictions,
                                                double[] distances,
                                                int label,
                                                int numFeatures,
                                                FeatureSelection featureSelection);

    /**
     * 由核函数与输出开关构造拟合器。
     */
    @FunctionalInterface
    interface Factory {
        SurrogateFitter create(ExponentialKernel kernel, boolean verbose);
    }
}
