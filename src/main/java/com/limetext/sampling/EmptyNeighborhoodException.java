package com.limetext.sampling;

public class EmptyNeighborhoodException extends RuntimeException {
    private final int numFeatures;

    public EmptyNeighborhoodException(int numFeatures) {
        super("文档特征数不足，无法生成邻域: numFeatures=" + numFeatures + "（至少需要 2 个）");
        this.numFeatures = numFeatures;
    }

    public int getNumFeatures() {
        return numFeatures;
    }
}
