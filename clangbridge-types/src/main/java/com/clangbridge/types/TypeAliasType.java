package com.clangbridge.types;

import java.util.Objects;

/**
 * 类型别名：一层语法糖，包裹另一个 TypeNode。
 * 别名自身也是声明，已知类型表可以直接为别名登记映射。
 */
public final class TypeAliasType extends TypeNode {

    private final NominalDecl decl;
    private final TypeNode underlying;

    /**
     * underlying 允许为 null 仅为了让上游的错误数据能被投影阶段识别为契约违规，
     * 正常构造都应传入非空的底层类型。
     */
    public TypeAliasType(NominalDecl decl, TypeNode underlying) {
        this.decl = Objects.requireNonNull(decl, "decl");
        this.underlying = underlying;
    }

    public NominalDecl getDecl() {
        return decl;
    }

    /** 去掉恰好一层语法糖后的类型 */
    public TypeNode getSinglyDesugaredType() {
        return underlying;
    }

    /** 一路展开到第一个非别名节点 */
    public TypeNode getDesugaredType() {
        TypeNode current = underlying;
        while (current instanceof TypeAliasType) {
            current = ((TypeAliasType) current).underlying;
        }
        return current;
    }

    @Override
    public String getDescription() {
        return decl.getName();
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor, OptionalKind optionalKind) {
        return visitor.visitAlias(this, optionalKind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeAliasType)) return false;
        TypeAliasType that = (TypeAliasType) o;
        return decl.equals(that.decl) && Objects.equals(underlying, that.underlying);
    }

    @Override
    public int hashCode() {
        return Objects.hash(decl, underlying);
    }
}
