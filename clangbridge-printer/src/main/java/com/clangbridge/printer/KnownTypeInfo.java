package com.clangbridge.printer;

import java.util.Objects;

/**
 * 已知类型在目标方言中的名字，以及该类型能否承载可空性标注。
 */
public final class KnownTypeInfo {

    private final String name;
    private final boolean canBeNullable;

    public KnownTypeInfo(String name, boolean canBeNullable) {
        this.name = Objects.requireNonNull(name, "name");
        this.canBeNullable = canBeNullable;
    }

    public String getName() {
        return name;
    }

    public boolean canBeNullable() {
        return canBeNullable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KnownTypeInfo)) return false;
        KnownTypeInfo that = (KnownTypeInfo) o;
        return canBeNullable == that.canBeNullable && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, canBeNullable);
    }

    @Override
    public String toString() {
        return canBeNullable ? name + " (nullable)" : name;
    }
}
