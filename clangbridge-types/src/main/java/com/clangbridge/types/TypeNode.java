package com.clangbridge.types;

/**
 * 源类型图的不可变节点。
 * <p>
 * 变体集合是封闭的：{@link NominalType}、{@link TypeAliasType}、{@link TupleType}、
 * {@link OpaqueType}。每个变体通过 {@link #accept} 分派到 {@link TypeNodeVisitor}
 * 的对应方法，新增变体时所有访问者都必须补上处理才能编译。
 */
public abstract class TypeNode {

    TypeNode() {
    }

    /** 源语言层面的类型拼写，用于占位注释和诊断 */
    public abstract String getDescription();

    /** 接受访问者，可选性随调用一同传递 */
    public abstract <R> R accept(TypeNodeVisitor<R> visitor, OptionalKind optionalKind);

    @Override
    public String toString() {
        return getDescription();
    }
}
