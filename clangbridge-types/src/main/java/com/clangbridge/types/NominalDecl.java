package com.clangbridge.types;

import java.util.Objects;

/**
 * 具名声明（结构体、原始类型、类型别名）的身份。
 * 身份由限定名 module.name 决定，是已知类型表的查询键。
 */
public final class NominalDecl {

    private final String module;
    private final String name;

    public NominalDecl(String module, String name) {
        this.module = Objects.requireNonNull(module, "module");
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * 解析限定名 "Module.Name"。没有模块前缀时抛出 IllegalArgumentException。
     */
    public static NominalDecl parse(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        if (dot <= 0 || dot == qualifiedName.length() - 1) {
            throw new IllegalArgumentException("不是限定名: '" + qualifiedName + "'");
        }
        return new NominalDecl(qualifiedName.substring(0, dot), qualifiedName.substring(dot + 1));
    }

    public String getModule() {
        return module;
    }

    public String getName() {
        return name;
    }

    public String getQualifiedName() {
        return module + "." + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NominalDecl)) return false;
        NominalDecl that = (NominalDecl) o;
        return module.equals(that.module) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(module, name);
    }

    @Override
    public String toString() {
        return getQualifiedName();
    }
}
