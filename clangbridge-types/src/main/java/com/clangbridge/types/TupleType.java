package com.clangbridge.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 元组类型。空元组即 "无值"（Void）。
 */
public final class TupleType extends TypeNode {

    private final List<TypeNode> elements;

    public TupleType(List<TypeNode> elements) {
        this.elements = elements == null || elements.isEmpty()
                ? Collections.<TypeNode>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public List<TypeNode> getElements() {
        return elements;
    }

    public int getNumElements() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public String getDescription() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i).getDescription());
        }
        sb.append(')');
        return sb.toString();
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor, OptionalKind optionalKind) {
        return visitor.visitTuple(this, optionalKind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TupleType)) return false;
        return elements.equals(((TupleType) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
