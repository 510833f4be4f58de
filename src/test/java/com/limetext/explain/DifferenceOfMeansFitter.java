package com.limetext.explain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 测试用拟合器：特征权重取“特征存在时的平均预测”减去“特征缺失时的平均预测”，
 * 按绝对值降序截断。同时记录最近一次调用的参数。
 */
class DifferenceOfMeansFitter implements SurrogateFitter {
    final ExponentialKernel kernel;
    final boolean verbose;
    final List<Integer> fittedLabels = new ArrayList<>();
    double[][] lastData;
    double[] lastDistances;
    int lastNumFeatures;
    FeatureSelection lastFeatureSelection;

    DifferenceOfMeansFitter(ExponentialKernel kernel, boolean verbose) {
        this.kernel = kernel;
        this.verbose = verbose;
    }

    @Override
    public List<FeatureWeight> explainInstanceWithData(double[][] data, double[][] predictions, double[] distances,
                                                       int label, int numFeatures, FeatureSelection featureSelection) {
        fittedLabels.add(label);
        lastData = data;
        lastDistances = distances;
        lastNumFeatures = numFeatures;
        lastFeatureSelection = featureSelection;

        int featureCount = data[0].length;
        List<FeatureWeight> weights = new ArrayList<>();
        for (int featureId = 0; featureId < featureCount; featureId++) {
            double presentSum = 0;
            double absentSum = 0;
            int present = 0;
            int absent = 0;
            for (int row = 0; row < data.length; row++) {
                if (data[row][featureId] > 0) {
                    presentSum += predictions[row][label];
                    present++;
                } else {
                    absentSum += predictions[row][label];
                    absent++;
                }
            }
            double weight = present == 0 || absent == 0 ? 0.0 : presentSum / present - absentSum / absent;
            weights.add(new FeatureWeight(featureId, weight));
        }
        weights.sort(Comparator.comparingDouble((FeatureWeight weight) -> Math.abs(weight.weight())).reversed());
        return List.copyOf(weights.subList(0, Math.min(numFeatures, weights.size())));
    }
}
