package com.clangbridge.printer;

import com.clangbridge.types.NominalDecl;
import com.clangbridge.types.OptionalKind;

import java.util.Objects;
import java.util.Optional;

/**
 * C / Objective-C 兼容方言：无参数写 void，匿名参数不命名。
 */
public final class CCompatiblePolicy implements DialectPolicy {

    private final TypeMapping typeMapping;
    private final OutputLanguageMode mode;

    public CCompatiblePolicy(TypeMapping typeMapping, OutputLanguageMode mode) {
        this.typeMapping = Objects.requireNonNull(typeMapping, "typeMapping");
        if (mode == null || mode.getDialect() != Dialect.C_COMPATIBLE) {
            throw new IllegalArgumentException("C 兼容方言只接受 C 或 OBJC 模式，实际: " + mode);
        }
        this.mode = mode;
    }

    @Override
    public OutputLanguageMode getMode() {
        return mode;
    }

    @Override
    public Optional<KnownTypeInfo> lookup(NominalDecl decl) {
        return typeMapping.lookup(decl, mode);
    }

    @Override
    public String annotate(String baseText, OptionalKind optionalKind) {
        return NullabilityAnnotator.annotate(baseText, optionalKind, Dialect.C_COMPATIBLE);
    }

    @Override
    public void printEmptyParameterList(StringBuilder os) {
        // C 中 () 表示 "参数未指定"
        os.append("void");
    }

    @Override
    public String anonymousParameterName(int index) {
        return null;
    }
}
