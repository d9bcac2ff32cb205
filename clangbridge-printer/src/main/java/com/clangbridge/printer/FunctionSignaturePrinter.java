package com.clangbridge.printer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 把函数签名打印为 C 兼容或 C++ 的前向声明。
 * <p>
 * 打印器只持有不可变的协作者，可以在线程间共享；每次调用只写调用方提供的输出缓冲。
 * 无法表示的类型不会抛异常，而是以占位注释留在文本中并记录在 {@link PrintedDeclaration} 里。
 */
public class FunctionSignaturePrinter {

    private static final Logger LOG = Logger.getLogger(FunctionSignaturePrinter.class.getName());

    private final TypeMapping typeMapping;
    private final IdentifierPrinter identifierPrinter;

    public FunctionSignaturePrinter(TypeMapping typeMapping) {
        this(typeMapping, new ClangSyntaxPrinter());
    }

    public FunctionSignaturePrinter(TypeMapping typeMapping, IdentifierPrinter identifierPrinter) {
        this.typeMapping = Objects.requireNonNull(typeMapping, "typeMapping");
        this.identifierPrinter = Objects.requireNonNull(identifierPrinter, "identifierPrinter");
    }

    public TypeMapping getTypeMapping() {
        return typeMapping;
    }

    // ============ C 兼容 ============

    public PrintedDeclaration printAsCCompatibleDeclaration(FunctionSignature signature) {
        return printAsCCompatibleDeclaration(signature, OutputLanguageMode.C, new StringBuilder());
    }

    public PrintedDeclaration printAsCCompatibleDeclaration(FunctionSignature signature, OutputLanguageMode mode) {
        return printAsCCompatibleDeclaration(signature, mode, new StringBuilder());
    }

    public PrintedDeclaration printAsCCompatibleDeclaration(FunctionSignature signature, StringBuilder os) {
        return printAsCCompatibleDeclaration(signature, OutputLanguageMode.C, os);
    }

    /**
     * 以 C 或 Objective-C 表打印；mode 为 CXX 时抛出 IllegalArgumentException。
     */
    public PrintedDeclaration printAsCCompatibleDeclaration(FunctionSignature signature,
                                                           OutputLanguageMode mode, StringBuilder os) {
        return printDeclaration(signature, new CCompatiblePolicy(typeMapping, mode), os);
    }

    // ============ C++ ============

    public PrintedDeclaration printAsCxxDeclaration(FunctionSignature signature) {
        return printAsCxxDeclaration(signature, new StringBuilder());
    }

    public PrintedDeclaration printAsCxxDeclaration(FunctionSignature signature, StringBuilder os) {
        return printDeclaration(signature, new CxxPolicy(typeMapping), os);
    }

    /** 按输出模式分派 */
    public PrintedDeclaration print(FunctionSignature signature, OutputLanguageMode mode) {
        Objects.requireNonNull(mode, "mode");
        if (mode.getDialect() == Dialect.CXX) {
            return printAsCxxDeclaration(signature);
        }
        return printAsCCompatibleDeclaration(signature, mode);
    }

    // ============ 公共算法 ============

    private PrintedDeclaration printDeclaration(FunctionSignature signature, DialectPolicy policy,
                                                StringBuilder os) {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(os, "os");

        TypeProjectionVisitor typePrinter = new TypeProjectionVisitor(policy);
        ProjectionLog projections = new ProjectionLog();
        // 先写到局部缓冲，契约违规时调用方的缓冲保持不变
        StringBuilder decl = new StringBuilder();

        projections.print(typePrinter.project(signature.getReturnType(), signature.getReturnOptionality()), decl);
        decl.append(' ').append(signature.getName()).append('(');

        List<ParameterSignature> params = signature.getParameters();
        if (params.isEmpty()) {
            policy.printEmptyParameterList(decl);
        } else {
            String[] paramNames = assignParameterNames(params, policy);
            for (int i = 0; i < params.size(); i++) {
                if (i > 0) decl.append(", ");
                ParameterSignature param = params.get(i);
                projections.print(typePrinter.project(param.getType(), param.getOptionality()), decl);
                if (paramNames[i] != null) {
                    decl.append(' ').append(paramNames[i]);
                }
            }
        }
        decl.append(')');

        os.append(decl);
        if (!projections.unrepresentable.isEmpty() && LOG.isLoggable(Level.FINE)) {
            LOG.fine(signature.getName() + " 含无法表示的类型 " + projections.unrepresentable
                    + " (" + policy.getMode().getKey() + ")");
        }
        return new PrintedDeclaration(policy.getMode(), decl.toString(),
                projections.unrepresentable, projections.droppedOptionality);
    }

    /**
     * 为每个参数确定合法化后的名字，null 表示不写名字。
     * 声明的名字先占位，合成的 _i 其后；重名时追加 "_k" 后缀，直到在本声明内唯一。
     */
    private String[] assignParameterNames(List<ParameterSignature> params, DialectPolicy policy) {
        String[] names = new String[params.size()];
        Set<String> used = new HashSet<>();
        for (int i = 0; i < params.size(); i++) {
            ParameterSignature param = params.get(i);
            if (!param.isAnonymous()) {
                names[i] = uniqueName(legalize(param.getName()), used);
            }
        }
        for (int i = 0; i < params.size(); i++) {
            if (!params.get(i).isAnonymous()) continue;
            String synthesized = policy.anonymousParameterName(i + 1);
            if (synthesized != null) {
                names[i] = uniqueName(legalize(synthesized), used);
            }
        }
        return names;
    }

    private String legalize(String name) {
        StringBuilder legal = new StringBuilder();
        identifierPrinter.printIdentifier(legal, name);
        return legal.toString();
    }

    private static String uniqueName(String base, Set<String> used) {
        String candidate = base;
        for (int k = 1; !used.add(candidate); k++) {
            candidate = base + "_" + k;
        }
        if (!candidate.equals(base) && LOG.isLoggable(Level.FINE)) {
            LOG.fine("参数名 " + base + " 重复，改为 " + candidate);
        }
        return candidate;
    }

    /** 一次打印中各类型投影的汇总 */
    private static final class ProjectionLog {
        final List<String> unrepresentable = new ArrayList<>();
        boolean droppedOptionality;

        void print(TypeProjection projection, StringBuilder os) {
            if (!projection.isRepresentable()) {
                unrepresentable.add(projection.getUnrepresentableDescription());
            }
            droppedOptionality |= projection.isOptionalityDropped();
            projection.printTo(os);
        }
    }
}
