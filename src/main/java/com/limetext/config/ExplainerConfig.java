package com.limetext.config;

import com.limetext.document.IndexMode;
import com.limetext.explain.FeatureSelection;

import java.util.List;

/**
 * 解释器运行时配置
 * 
 * 支持从CLI参数或代码注入，覆盖Constants默认值
 */
public class ExplainerConfig {
    private double kernelWidth = Constants.DEFAULT_KERNEL_WIDTH;
    private boolean verbose = false;
    private List<String> classNames;
    private FeatureSelection featureSelection = FeatureSelection.AUTO;
    private IndexMode indexMode = IndexMode.BOW;
    private Long randomSeed;
    
    public double getKernelWidth() {
        return kernelWidth;
    }
    
    public void setKernelWidth(double kernelWidth) {
        this.kernelWidth = kernelWidth;
    }
    
    public boolean isVerbose() {
        return verbose;
    }
    
    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }
    
    /**
     * 类别名称，顺序与分类器输出列一致；为null时按列号自动生成
     */
    public List<String> getClassNames() {
        return classNames;
    }
    
    public void setClassNames(List<String> classNames) {
        this.classNames = classNames == null ? null : List.copyOf(classNames);
    }
    
    public FeatureSelection getFeatureSelection() {
        return featureSelection;
    }
    
    public void setFeatureSelection(FeatureSelection featureSelection) {
        this.featureSelection = featureSelection;
    }
    
    public IndexMode getIndexMode() {
        return indexMode;
    }
    
    public void setIndexMode(IndexMode indexMode) {
        this.indexMode = indexMode;
    }
    
    /**
     * 随机种子，为null时每个解释器使用非确定性随机源
     */
    public Long getRandomSeed() {
        return randomSeed;
    }
    
    public void setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static ExplainerConfig defaults() {
        return new ExplainerConfig();
    }
}
