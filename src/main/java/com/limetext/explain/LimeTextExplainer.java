package com.limetext.explain;

import com.limetext.config.ExplainerConfig;
import com.limetext.document.IndexMode;
import com.limetext.document.IndexedDocument;
import com.limetext.sampling.ClassifierFunction;
import com.limetext.sampling.Neighborhood;
import com.limetext.sampling.NeighborhoodSampler;
import com.limetext.sampling.PredictionContractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 文本分类器解释器。
 *
 * 先随机隐藏原文中的词生成邻域，再交给代理模型拟合器在邻域上为每个标签
 * 学习局部加权线性模型。
 */
public class LimeTextExplainer {
    private static final Logger logger = LoggerFactory.getLogger(LimeTextExplainer.class);

    private final IndexMode indexMode;
    private final FeatureSelection featureSelection;
    private final boolean verbose;
    private final ExponentialKernel kernel;
    private final SurrogateFitter fitter;
    private final Random random;
    /** 未配置类别名时由首次预测结果生成，之后不再改变 */
    private final AtomicReference<List<String>> classNames = new AtomicReference<>();

    public LimeTextExplainer(ExplainerConfig config, SurrogateFitter.Factory fitterFactory) {
        this(config, fitterFactory, config.getRandomSeed() == null ? new Random() : new Random(config.getRandomSeed()));
    }

    /**
     * 配置在构造时一次性复制，之后修改 config 不影响本实例。
     */
    public LimeTextExplainer(ExplainerConfig config, SurrogateFitter.Factory fitterFactory, Random random) {
        if (config.getFeatureSelection() == null) {
            throw new IllegalArgumentException("特征选择方式不能为null");
        }
        if (config.getIndexMode() == null) {
            throw new IllegalArgumentException("索引模式不能为null");
        }
        if (config.getClassNames() != null && config.getClassNames().isEmpty()) {
            throw new IllegalArgumentException("类别名列表不能为空");
        }
        this.indexMode = config.getIndexMode();
        this.featureSelection = config.getFeatureSelection();
        this.verbose = config.isVerbose();
        this.kernel = new ExponentialKernel(config.getKernelWidth());
        this.fitter = fitterFactory.create(kernel, verbose);
        this.random = random;
        this.classNames.set(config.getClassNames());
    }

    public ExponentialKernel kernel() {
        return kernel;
    }

    public Explanation explainInstance(String textInstance, ClassifierFunction classifier) {
        return explainInstance(textInstance, classifier, ExplainOptions.defaults());
    }

    /**
     * 为一条文本的预测生成解释。
     */
    public Explanation explainInstance(String textInstance, ClassifierFunction classifier, ExplainOptions options) {
        IndexedDocument document = IndexedDocument.of(textInstance, indexMode);
        Neighborhood neighborhood = new NeighborhoodSampler(random).sample(document, classifier, options.numSamples());
        double[] instancePrediction = neighborhood.instancePrediction();
        List<String> names = resolveClassNames(neighborhood.numClasses());

        List<Integer> labels = options.labels();
        List<Integer> topLabels = null;
        if (options.topLabels() != null) {
            topLabels = selectTopLabels(instancePrediction, options.topLabels());
            labels = topLabels;
        }

        for (int label : labels) {
            if (label < 0 || label >= neighborhood.numClasses()) {
                throw new IllegalArgumentException("标签越界: " + label + ", 类别数 " + neighborhood.numClasses());
            }
        }

        Explanation explanation = new Explanation(document, names, instancePrediction, topLabels);
        for (int label : labels) {
            List<FeatureWeight> weights = fitter.explainInstanceWithData(neighborhood.data(), neighborhood.predictions(),
                neighborhood.distances(), label, options.numFeatures(), featureSelection);
            if (weights == null) {
                throw new IllegalStateException("拟合器返回了null, label=" + label);
            }
            explanation.put(label, weights);
            if (verbose) {
                logger.info("标签 {} ({}) 概率 {}，解释特征数 {}", label, names.get(label), instancePrediction[label], weights.size());
            } else {
                logger.debug("标签 {} 解释特征数 {}", label, weights.size());
            }
        }
        return explanation;
    }

    private List<String> resolveClassNames(int numClasses) {
        List<String> current = classNames.get();
        if (current == null) {
            List<String> generated = new ArrayList<>(numClasses);
            for (int index = 0; index < numClasses; index++) {
                generated.add(String.valueOf(index));
            }
            classNames.compareAndSet(null, List.copyOf(generated));
            current = classNames.get();
        }
        if (current.size() != numClasses) {
            throw new PredictionContractException("分类器输出列数与类别名数量不一致", current.size(), numClasses);
        }
        return current;
    }

    /**
     * 取概率最高的 k 个类别，按概率降序，概率相同时下标小者在前。
     */
    static List<Integer> selectTopLabels(double[] probabilities, int k) {
        Integer[] order = new Integer[probabilities.length];
        for (int index = 0; index < order.length; index++) {
            order[index] = index;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer index) -> probabilities[index]).reversed()
            .thenComparingInt(index -> index));
        int limit = Math.min(k, order.length);
        return List.of(Arrays.copyOf(order, limit));
    }
}
