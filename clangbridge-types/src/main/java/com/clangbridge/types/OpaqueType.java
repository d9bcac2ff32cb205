package com.clangbridge.types;

import java.util.Objects;

/**
 * 其他已完全规约、未单独分类的类型（函数类型、泛型实例等），只保留文字描述。
 */
public final class OpaqueType extends TypeNode {

    private final String description;

    public OpaqueType(String description) {
        this.description = Objects.requireNonNull(description, "description");
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor, OptionalKind optionalKind) {
        return visitor.visitOpaque(this, optionalKind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OpaqueType)) return false;
        return description.equals(((OpaqueType) o).description);
    }

    @Override
    public int hashCode() {
        return description.hashCode();
    }
}
