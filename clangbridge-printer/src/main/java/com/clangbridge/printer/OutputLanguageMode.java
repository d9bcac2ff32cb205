package com.clangbridge.printer;

import java.util.Locale;

/**
 * 输出语言模式。每个模式对应已知类型表的一个分区；
 * C 与 OBJC 共享 C 兼容方言的打印规则，只是查询的表不同。
 */
public enum OutputLanguageMode {
    C(Dialect.C_COMPATIBLE),
    OBJC(Dialect.C_COMPATIBLE),
    CXX(Dialect.CXX);

    private final Dialect dialect;

    OutputLanguageMode(Dialect dialect) {
        this.dialect = dialect;
    }

    public Dialect getDialect() {
        return dialect;
    }

    /** 小写名，用于配置文件和命令行 */
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 按小写名查找，未知名字抛出 IllegalArgumentException */
    public static OutputLanguageMode fromKey(String key) {
        for (OutputLanguageMode mode : values()) {
            if (mode.getKey().equals(key.toLowerCase(Locale.ROOT))) {
                return mode;
            }
        }
        throw new IllegalArgumentException("未知输出模式 '" + key + "'（可选: c, objc, cxx）");
    }
}
