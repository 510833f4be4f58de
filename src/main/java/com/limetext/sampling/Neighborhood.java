package com.limetext.sampling;

import java.util.List;

/**
 * 邻域数据集：二值设计矩阵、分类器输出与距离，行与行一一对应。
 *
 * 访问器直接返回内部数组，交给拟合器的矩阵不应被修改；{@link #row(int)} 返回副本。
 */
public record Neighborhood(
    double[][] data,
    List<String> texts,
    double[][] predictions,
    double[] distances
) {

    public int size() {
        return data.length;
    }

    public int numClasses() {
        return predictions.length == 0 ? 0 : predictions[0].length;
    }

    /**
     * 第 0 行：原文本身的预测概率。
     */
    public double[] instancePrediction() {
        return predictions[0];
    }

    public NeighborhoodSample row(int index) {
        if (index < 0 || index >= data.length) {
            throw new IndexOutOfBoundsException("样本行越界: " + index);
        }
        return new NeighborhoodSample(data[index].clone(), texts.get(index), predictions[index].clone(), distances[index]);
    }
}
