package com.clangbridge.cli;

import java.util.Locale;

/**
 * 含无法表示类型的声明如何输出
 */
public enum UnsupportedPolicy {
    /** 原样输出（带占位注释） */
    EMIT,
    /** 整行注释掉 */
    COMMENT_OUT,
    /** 不输出，只记日志 */
    OMIT;

    public String getKey() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static UnsupportedPolicy fromKey(String key) {
        for (UnsupportedPolicy policy : values()) {
            if (policy.getKey().equalsIgnoreCase(key)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("未知策略 '" + key + "'（可选: emit, comment-out, omit）");
    }
}
