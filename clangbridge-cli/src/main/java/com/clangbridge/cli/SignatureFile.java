package com.clangbridge.cli;

import com.clangbridge.printer.FunctionSignature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个签名描述文件的内容：模块名与其中的函数签名
 */
public final class SignatureFile {

    private final String module;
    private final List<FunctionSignature> functions;

    public SignatureFile(String module, List<FunctionSignature> functions) {
        this.module = module;
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
    }

    public String getModule() {
        return module;
    }

    public List<FunctionSignature> getFunctions() {
        return functions;
    }
}
