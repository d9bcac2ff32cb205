package com.clangbridge.types;

/**
 * 可选性标记：值是否可能缺失，以及缺失是否为隐式声明。
 */
public enum OptionalKind {
    /** 非可选 */
    NONE,
    /** 显式可选（T?） */
    OPTIONAL,
    /** 隐式解包可选（T!） */
    IMPLICITLY_UNWRAPPED;

    public boolean isOptional() {
        return this != NONE;
    }
}
