package com.clangbridge.printer;

import com.clangbridge.types.NominalDecl;
import com.clangbridge.types.OptionalKind;

import java.util.Objects;
import java.util.Optional;

/**
 * C++ 方言：无参数写 ()，匿名参数按位置命名为 _1、_2 ...
 */
public final class CxxPolicy implements DialectPolicy {

    private final TypeMapping typeMapping;

    public CxxPolicy(TypeMapping typeMapping) {
        this.typeMapping = Objects.requireNonNull(typeMapping, "typeMapping");
    }

    @Override
    public OutputLanguageMode getMode() {
        return OutputLanguageMode.CXX;
    }

    @Override
    public Optional<KnownTypeInfo> lookup(NominalDecl decl) {
        return typeMapping.lookup(decl, OutputLanguageMode.CXX);
    }

    @Override
    public String annotate(String baseText, OptionalKind optionalKind) {
        // TODO: 可选性改为以 swift::Optional<T> 之类的包装类型表达后，在这里生成对应文本
        return NullabilityAnnotator.annotate(baseText, optionalKind, Dialect.CXX);
    }

    @Override
    public void printEmptyParameterList(StringBuilder os) {
    }

    @Override
    public String anonymousParameterName(int index) {
        return "_" + index;
    }
}
