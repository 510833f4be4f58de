package com.limetext.sampling;

import com.limetext.config.Constants;
import com.limetext.document.IndexedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * 邻域采样器：随机移除特征生成扰动文本，批量调用分类器并计算与原文的距离。
 */
public class NeighborhoodSampler {
    private static final Logger logger = LoggerFactory.getLogger(NeighborhoodSampler.class);

    private final Random random;

    public NeighborhoodSampler(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("随机源不能为null");
        }
        this.random = random;
    }

    /**
     * 生成扰动矩阵与重建文本，不调用分类器。
     */
    public Perturbations perturb(IndexedDocument document, int numSamples) {
        if (numSamples < 1) {
            throw new IllegalArgumentException("样本数必须为正数: " + numSamples);
        }
        int docSize = document.numFeatures();
        if (docSize <= 1) {
            throw new EmptyNeighborhoodException(docSize);
        }

        double[][] data = new double[numSamples][docSize];
        List<String> texts = new ArrayList<>(numSamples);
        Arrays.fill(data[0], 1.0);
        texts.add(document.rawString());

        int[] featureIds = new int[docSize];
        for (int row = 1; row < numSamples; row++) {
            Arrays.fill(data[row], 1.0);
            // 移除数量取 [1, docSize - 1]，不会移除全部特征
            int size = 1 + random.nextInt(docSize - 1);
            int[] inactive = chooseWithoutReplacement(featureIds, size);
            for (int featureId : inactive) {
                data[row][featureId] = 0.0;
            }
            texts.add(document.remove(inactive));
        }

        double[] distances = CosineDistance.toFirstRow(data);
        for (int row = 0; row < distances.length; row++) {
            distances[row] *= Constants.DISTANCE_SCALE;
        }
        distances[0] = 0.0;

        logger.debug("生成邻域: samples={}, features={}", numSamples, docSize);
        return new Perturbations(data, List.copyOf(texts), distances);
    }

    /**
     * 生成邻域并一次性批量调用分类器。
     */
    public Neighborhood sample(IndexedDocument document, ClassifierFunction classifier, int numSamples) {
        if (classifier == null) {
            throw new IllegalArgumentException("分类器不能为null");
        }
        Perturbations perturbations = perturb(document, numSamples);
        double[][] predictions = classifier.predictProba(perturbations.texts());
        validatePredictions(predictions, numSamples);
        return new Neighborhood(perturbations.data(), perturbations.texts(), predictions, perturbations.distances());
    }

    /**
     * 部分 Fisher-Yates 洗牌，从 [0, pool.length) 中无放回抽取 size 个编号。
     */
    private int[] chooseWithoutReplacement(int[] pool, int size) {
        for (int index = 0; index < pool.length; index++) {
            pool[index] = index;
        }
        for (int index = 0; index < size; index++) {
            int swapIndex = index + random.nextInt(pool.length - index);
            int chosen = pool[swapIndex];
            pool[swapIndex] = pool[index];
            pool[index] = chosen;
        }
        return Arrays.copyOf(pool, size);
    }

    private void validatePredictions(double[][] predictions, int numSamples) {
        if (predictions == null) {
            throw new PredictionContractException("分类器返回了null");
        }
        if (predictions.length != numSamples) {
            throw new PredictionContractException("分类器返回行数与输入文本数不一致", numSamples, predictions.length);
        }
        if (predictions[0] == null || predictions[0].length == 0) {
            throw new PredictionContractException("分类器返回的类别数必须为正数");
        }
        int numClasses = predictions[0].length;
        for (int row = 1; row < predictions.length; row++) {
            if (predictions[row] == null) {
                throw new PredictionContractException("分类器第 " + row + " 行输出为null");
            }
            if (predictions[row].length != numClasses) {
                throw new PredictionContractException("分类器第 " + row + " 行类别数不一致", numClasses, predictions[row].length);
            }
        }
    }
}
