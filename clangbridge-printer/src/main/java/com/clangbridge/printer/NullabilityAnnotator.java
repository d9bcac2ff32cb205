package com.clangbridge.printer;

import com.clangbridge.types.OptionalKind;

/**
 * 可空性标注：在类型文本后追加方言相关的限定符。
 * <p>
 * C 兼容方言使用 Clang 的可空性限定符；C++ 方言目前没有文本标注，
 * 可选性需要由别处以结构方式表达。
 */
public final class NullabilityAnnotator {

    private NullabilityAnnotator() {}

    /**
     * 返回应追加的限定符（含前导空格），无标注时返回空串。
     */
    public static String nullabilityToken(OptionalKind optionalKind, Dialect dialect) {
        if (optionalKind == null || dialect != Dialect.C_COMPATIBLE) return "";
        switch (optionalKind) {
            case OPTIONAL:
                return " _Nullable";
            case IMPLICITLY_UNWRAPPED:
                return " _Null_unspecified";
            case NONE:
            default:
                return "";
        }
    }

    /** NONE 时原样返回 baseText */
    public static String annotate(String baseText, OptionalKind optionalKind, Dialect dialect) {
        return baseText + nullabilityToken(optionalKind, dialect);
    }
}
