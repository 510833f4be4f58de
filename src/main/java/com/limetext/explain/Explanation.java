package com.limetext.explain;

import com.limetext.document.IndexedDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 单条预测的局部解释结果，由调用方持有。
 */
public class Explanation {
    private final IndexedDocument document;
    private final List<String> classNames;
    private final double[] predictProba;
    private final List<Integer> topLabels;
    private final Map<Integer, List<FeatureWeight>> localExp = new LinkedHashMap<>();

    Explanation(IndexedDocument document, List<String> classNames, double[] predictProba, List<Integer> topLabels) {
        this.document = document;
        this.classNames = List.copyOf(classNames);
        this.predictProba = predictProba.clone();
        this.topLabels = topLabels == null ? null : List.copyOf(topLabels);
    }

    void put(int label, List<FeatureWeight> weights) {
        localExp.put(label, List.copyOf(weights));
    }

    public IndexedDocument document() {
        return document;
    }

    public List<String> classNames() {
        return classNames;
    }

    /**
     * 原文本身的类别概率。
     */
    public double[] predictProba() {
        return predictProba.clone();
    }

    public Optional<List<Integer>> topLabels() {
        return Optional.ofNullable(topLabels);
    }

    public Map<Integer, List<FeatureWeight>> localExp() {
        return Collections.unmodifiableMap(localExp);
    }

    /**
     * 请求了 topLabels 时按概率降序返回这些标签，否则返回已解释的标签。
     */
    public List<Integer> availableLabels() {
        if (topLabels != null) {
            return topLabels;
        }
        return List.copyOf(localExp.keySet());
    }

    public List<FeatureWeight> weights(int label) {
        List<FeatureWeight> weights = localExp.get(label);
        if (weights == null) {
            throw new IllegalArgumentException("标签未被解释: " + label + ", 可用标签 " + localExp.keySet());
        }
        return weights;
    }

    /**
     * 将特征编号映射回原文词。
     */
    public List<WordWeight> asList(int label) {
        List<WordWeight> words = new ArrayList<>();
        for (FeatureWeight featureWeight : weights(label)) {
            words.add(new WordWeight(document.featureText(featureWeight.featureId()), featureWeight.weight()));
        }
        return words;
    }

    public Map<Integer, List<FeatureWeight>> asMap() {
        return localExp();
    }

    /**
     * 每个被解释特征在原文中的所有出现区间，按起始偏移排序，供渲染使用。
     */
    public List<HighlightSpan> highlightSpans(int label) {
        List<HighlightSpan> spans = new ArrayList<>();
        for (FeatureWeight featureWeight : weights(label)) {
            int featureId = featureWeight.featureId();
            int length = document.featureText(featureId).length();
            for (int start : document.featurePositions(featureId)) {
                spans.add(new HighlightSpan(start, start + length, featureId, featureWeight.weight()));
            }
        }
        spans.sort(Comparator.comparingInt(HighlightSpan::start));
        return spans;
    }
}
