package com.clangbridge.types;

import java.util.Objects;

/**
 * 具名类型：原始类型或聚合类型（结构体等）。
 */
public final class NominalType extends TypeNode {

    private final NominalDecl decl;

    public NominalType(NominalDecl decl) {
        this.decl = Objects.requireNonNull(decl, "decl");
    }

    public NominalDecl getDecl() {
        return decl;
    }

    @Override
    public String getDescription() {
        return decl.getName();
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor, OptionalKind optionalKind) {
        return visitor.visitNominal(this, optionalKind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NominalType)) return false;
        return decl.equals(((NominalType) o).decl);
    }

    @Override
    public int hashCode() {
        return decl.hashCode();
    }
}
