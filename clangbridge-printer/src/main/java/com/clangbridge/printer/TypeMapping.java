package com.clangbridge.printer;

import com.clangbridge.types.NominalDecl;

import java.util.Optional;

/**
 * 已知类型表：源声明 → 目标方言类型名。
 * 实现必须是纯查询、无副作用，且在一次编译会话内不可变，打印器会跨线程共享它。
 */
public interface TypeMapping {

    Optional<KnownTypeInfo> lookup(NominalDecl decl, OutputLanguageMode mode);
}
