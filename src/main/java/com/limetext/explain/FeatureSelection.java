package com.limetext.explain;

import java.util.Locale;

/**
 * 代理模型的特征选择方式，取值与外部拟合器约定的名称一致。
 */
public enum FeatureSelection {
    FORWARD_SELECTION("forward_selection"),
    LASSO_PATH("lasso_path"),
    NONE("none"),
    AUTO("auto");

    private final String wireName;

    FeatureSelection(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static FeatureSelection fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("特征选择方式不能为空");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (FeatureSelection selection : values()) {
            if (selection.wireName.equals(normalized)) {
                return selection;
            }
        }
        throw new IllegalArgumentException("未知特征选择方式: " + name);
    }
}
