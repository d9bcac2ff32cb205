package com.clangbridge.cli;

import com.clangbridge.printer.FunctionSignature;
import com.clangbridge.printer.FunctionSignaturePrinter;
import com.clangbridge.printer.OutputLanguageMode;
import com.clangbridge.printer.PrintedDeclaration;

import java.util.logging.Logger;

/**
 * 把一个签名文件输出为按模式分组的声明片段，每行一条声明。
 */
public class DeclarationEmitter {

    private static final Logger LOG = Logger.getLogger(DeclarationEmitter.class.getName());

    private final FunctionSignaturePrinter printer;
    private final EmitterConfig config;
    private int unsupportedCount;

    public DeclarationEmitter(FunctionSignaturePrinter printer, EmitterConfig config) {
        this.printer = printer;
        this.config = config;
    }

    /** 上一次 {@link #emit} 中无法完整表示的声明数（按模式分别计数） */
    public int getUnsupportedCount() {
        return unsupportedCount;
    }

    public String emit(SignatureFile file) {
        unsupportedCount = 0;
        StringBuilder out = new StringBuilder();
        if (config.isIncludeBanner()) {
            out.append("// Generated by clangbridge from module ").append(file.getModule()).append('\n');
        }
        boolean first = true;
        for (OutputLanguageMode mode : config.getModes()) {
            if (!first || config.isIncludeBanner()) out.append('\n');
            first = false;
            if (config.isIncludeBanner()) {
                out.append("// ").append(mode.getKey()).append('\n');
            }
            for (FunctionSignature signature : file.getFunctions()) {
                emitDeclaration(printer.print(signature, mode), signature, out);
            }
        }
        return out.toString();
    }

    private void emitDeclaration(PrintedDeclaration decl, FunctionSignature signature, StringBuilder out) {
        if (decl.isUsable()) {
            out.append(decl.getText()).append(";\n");
            return;
        }
        unsupportedCount++;
        switch (config.getUnsupportedPolicy()) {
            case EMIT:
                out.append(decl.getText()).append(";\n");
                break;
            case COMMENT_OUT:
                // 每一行都加行注释，多行文本也不会漏出可编译的代码
                String[] lines = (decl.getText() + ";").split("\r\n|\r|\n", -1);
                out.append("// unsupported: ").append(lines[0]).append('\n');
                for (int i = 1; i < lines.length; i++) {
                    out.append("// ").append(lines[i]).append('\n');
                }
                break;
            case OMIT:
            default:
                LOG.warning("省略 " + signature.getName() + " (" + decl.getMode().getKey()
                        + ")：无法表示的类型 " + decl.getUnrepresentableTypes());
                break;
        }
    }
}
