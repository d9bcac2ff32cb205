package com.clangbridge.printer;

/**
 * 输出方言：决定空参数列表、匿名参数命名和可空性标注规则。
 */
public enum Dialect {
    /** 纯 C / Objective-C 兼容 */
    C_COMPATIBLE,
    /** C++ */
    CXX
}
