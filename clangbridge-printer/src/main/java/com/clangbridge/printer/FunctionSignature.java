package com.clangbridge.printer;

import com.clangbridge.types.OptionalKind;
import com.clangbridge.types.TypeNode;
import com.clangbridge.types.Types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 待打印的函数签名。name 是调用方已确定的 C 符号名，按原样输出。
 */
public final class FunctionSignature {

    private final String name;
    private final TypeNode returnType;
    private final OptionalKind returnOptionality;
    private final List<ParameterSignature> parameters;

    public FunctionSignature(String name, TypeNode returnType, OptionalKind returnOptionality,
                             List<ParameterSignature> parameters) {
        Objects.requireNonNull(name, "name");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("函数名不能为空");
        }
        this.name = name;
        this.returnType = Objects.requireNonNull(returnType, "returnType");
        this.returnOptionality = returnOptionality != null ? returnOptionality : OptionalKind.NONE;
        this.parameters = parameters == null || parameters.isEmpty()
                ? Collections.<ParameterSignature>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public String getName() {
        return name;
    }

    public TypeNode getReturnType() {
        return returnType;
    }

    public OptionalKind getReturnOptionality() {
        return returnOptionality;
    }

    public List<ParameterSignature> getParameters() {
        return parameters;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("func ").append(name).append('(');
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(parameters.get(i));
        }
        return sb.append(") -> ").append(returnType.getDescription()).toString();
    }

    public static final class Builder {

        private final String name;
        private TypeNode returnType = Types.VOID;
        private OptionalKind returnOptionality = OptionalKind.NONE;
        private final List<ParameterSignature> parameters = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder returns(TypeNode type) {
            return returns(type, OptionalKind.NONE);
        }

        public Builder returns(TypeNode type, OptionalKind optionality) {
            this.returnType = type;
            this.returnOptionality = optionality;
            return this;
        }

        public Builder param(String paramName, TypeNode type) {
            parameters.add(ParameterSignature.named(paramName, type));
            return this;
        }

        public Builder param(String paramName, TypeNode type, OptionalKind optionality) {
            parameters.add(ParameterSignature.named(paramName, type, optionality));
            return this;
        }

        public Builder anonymousParam(TypeNode type) {
            parameters.add(ParameterSignature.anonymous(type));
            return this;
        }

        public Builder anonymousParam(TypeNode type, OptionalKind optionality) {
            parameters.add(ParameterSignature.anonymous(type, optionality));
            return this;
        }

        public Builder param(ParameterSignature parameter) {
            parameters.add(parameter);
            return this;
        }

        public FunctionSignature build() {
            return new FunctionSignature(name, returnType, returnOptionality, parameters);
        }
    }
}
