package com.clangbridge.printer;

import com.clangbridge.types.OptionalKind;
import com.clangbridge.types.TypeNode;

import java.util.Objects;

/**
 * 函数参数：可选的名字、已剥离可选包装的对象类型、可选性。
 */
public final class ParameterSignature {

    /** 源语言里匿名参数的写法 */
    public static final String ANONYMOUS_NAME = "_";

    private final String name;
    private final TypeNode type;
    private final OptionalKind optionality;

    public ParameterSignature(String name, TypeNode type, OptionalKind optionality) {
        this.name = name == null || name.isEmpty() || ANONYMOUS_NAME.equals(name) ? null : name;
        this.type = Objects.requireNonNull(type, "type");
        this.optionality = optionality != null ? optionality : OptionalKind.NONE;
    }

    public static ParameterSignature named(String name, TypeNode type) {
        return new ParameterSignature(name, type, OptionalKind.NONE);
    }

    public static ParameterSignature named(String name, TypeNode type, OptionalKind optionality) {
        return new ParameterSignature(name, type, optionality);
    }

    public static ParameterSignature anonymous(TypeNode type) {
        return new ParameterSignature(null, type, OptionalKind.NONE);
    }

    public static ParameterSignature anonymous(TypeNode type, OptionalKind optionality) {
        return new ParameterSignature(null, type, optionality);
    }

    /** 声明的名字，匿名参数（空串或 "_"）返回 null */
    public String getName() {
        return name;
    }

    public boolean isAnonymous() {
        return name == null;
    }

    public TypeNode getType() {
        return type;
    }

    public OptionalKind getOptionality() {
        return optionality;
    }

    @Override
    public String toString() {
        String typeText = type.getDescription();
        if (optionality == OptionalKind.OPTIONAL) typeText += "?";
        else if (optionality == OptionalKind.IMPLICITLY_UNWRAPPED) typeText += "!";
        return (name != null ? name : ANONYMOUS_NAME) + ": " + typeText;
    }
}
