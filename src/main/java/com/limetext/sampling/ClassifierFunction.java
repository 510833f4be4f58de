package com.limetext.sampling;

import java.util.List;

/**
 * 被解释的分类器：对一批原始文本输出类别概率矩阵。
 *
 * 返回矩阵的行顺序必须与输入顺序一致，列数等于类别数且在多次调用间保持不变。
 */
@FunctionalInterface
public interface ClassifierFunction {

    double[][] predictProba(List<String> documents);
}
