package com.limetext.config;

/**
 * 全局常量定义
 * 
 * 包含核函数、邻域采样、解释规模与命令行参数的默认值
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 核函数参数 ====================
    /** 指数核默认宽度 */
    public static final double DEFAULT_KERNEL_WIDTH = 25.0;

    // ==================== 邻域参数 ====================
    /** 邻域默认样本数（含原文本身） */
    public static final int DEFAULT_NUM_SAMPLES = 5000;
    /** 余弦距离缩放系数 */
    public static final double DISTANCE_SCALE = 100.0;

    // ==================== 解释参数 ====================
    /** 每个标签最多输出的特征数 */
    public static final int DEFAULT_NUM_FEATURES = 10;
    /** 未指定标签时默认解释的类别下标 */
    public static final int DEFAULT_LABEL = 1;

    // ==================== 命令行参数 ====================
    /** 命令行 perturb 默认样本数 */
    public static final int CLI_DEFAULT_SAMPLES = 10;
    /** 命令行 perturb 样本数上限 */
    public static final int CLI_MAX_SAMPLES = 10_000;
    /** 命令行输入文本长度上限 */
    public static final int MAX_TEXT_LENGTH = 1_000_000;
}
