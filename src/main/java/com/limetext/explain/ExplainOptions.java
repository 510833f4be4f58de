package com.limetext.explain;

import com.limetext.config.Constants;

import java.util.List;

/**
 * 单次解释请求的参数。
 *
 * @param labels      需要解释的类别下标，topLabels 非空时被忽略
 * @param topLabels   非空时改为解释概率最高的前 K 个类别
 * @param numFeatures 每个类别最多输出的特征数
 * @param numSamples  邻域样本数（含原文本身）
 */
public record ExplainOptions(
    List<Integer> labels,
    Integer topLabels,
    int numFeatures,
    int numSamples
) {

    public ExplainOptions {
        labels = labels == null ? List.of() : List.copyOf(labels);
        if (topLabels != null && topLabels < 1) {
            throw new IllegalArgumentException("topLabels 必须为正数: " + topLabels);
        }
        if (topLabels == null && labels.isEmpty()) {
            throw new IllegalArgumentException("请至少指定一个标签或 topLabels");
        }
        if (numFeatures < 1) {
            throw new IllegalArgumentException("numFeatures 必须为正数: " + numFeatures);
        }
        if (numSamples < 1) {
            throw new IllegalArgumentException("numSamples 必须为正数: " + numSamples);
        }
    }

    public static ExplainOptions defaults() {
        return new ExplainOptions(List.of(Constants.DEFAULT_LABEL), null,
            Constants.DEFAULT_NUM_FEATURES, Constants.DEFAULT_NUM_SAMPLES);
    }

    public ExplainOptions withLabels(Integer... labels) {
        return new ExplainOptions(List.of(labels), null, numFeatures, numSamples);
    }

    public ExplainOptions withTopLabels(int topLabels) {
        return new ExplainOptions(labels, topLabels, numFeatures, numSamples);
    }

    public ExplainOptions withNumFeatures(int numFeatures) {
        return new ExplainOptions(labels, topLabels, numFeatures, numSamples);
    }

    public ExplainOptions withNumSamples(int numSamples) {
        return new ExplainOptions(labels, topLabels, numFeatures, numSamples);
    }
}
