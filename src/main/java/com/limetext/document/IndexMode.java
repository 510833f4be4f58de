package com.limetext.document;

import java.util.Locale;

/**
 * 特征编号方式。
 */
public enum IndexMode {
    /** 词袋：同一个词的所有出现共享一个特征 */
    BOW("bow"),
    /** 位置敏感：每次出现都是独立特征 */
    POSITIONAL("positional");

    private final String wireName;

    IndexMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static IndexMode fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("索引模式不能为空");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (IndexMode mode : values()) {
            if (mode.wireName.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("未知索引模式: " + name);
    }
}
