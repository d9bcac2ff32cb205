package com.clangbridge.cli;

import com.clangbridge.types.OptionalKind;
import com.clangbridge.types.TypeNode;

import java.util.Objects;

/**
 * 剥掉可选包装后的对象类型及其可选性
 */
public final class ResolvedType {

    private final TypeNode type;
    private final OptionalKind optionality;

    public ResolvedType(TypeNode type, OptionalKind optionality) {
        this.type = Objects.requireNonNull(type, "type");
        this.optionality = Objects.requireNonNull(optionality, "optionality");
    }

    public TypeNode getType() {
        return type;
    }

    public OptionalKind getOptionality() {
        return optionality;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedType)) return false;
        ResolvedType that = (ResolvedType) o;
        return type.equals(that.type) && optionality == that.optionality;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, optionality);
    }

    @Override
    public String toString() {
        return type.getDescription() + " [" + optionality + "]";
    }
}
