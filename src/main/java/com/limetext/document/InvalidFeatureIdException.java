package com.limetext.document;

public class InvalidFeatureIdException extends RuntimeException {
    private final int featureId;
    private final int numFeatures;

    public InvalidFeatureIdException(int featureId, int numFeatures) {
        super("特征编号越界: id=" + featureId + ", 有效范围 [0, " + numFeatures + ")");
        this.featureId = featureId;
        this.numFeatures = numFeatures;
    }

    public int getFeatureId() {
        return featureId;
    }

    public int getNumFeatures() {
        return numFeatures;
    }
}
