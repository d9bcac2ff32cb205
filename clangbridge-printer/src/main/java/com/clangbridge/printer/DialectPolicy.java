package com.clangbridge.printer;

import com.clangbridge.types.NominalDecl;
import com.clangbridge.types.OptionalKind;

import java.util.Optional;

/**
 * 方言策略：打印算法只有一份，方言差异全部收敛到这里。
 */
public interface DialectPolicy {

    OutputLanguageMode getMode();

    /** 查询本方言分区的已知类型 */
    Optional<KnownTypeInfo> lookup(NominalDecl decl);

    /** 追加本方言的可空性标注 */
    String annotate(String baseText, OptionalKind optionalKind);

    /** 参数列表为空时写在括号内的内容 */
    void printEmptyParameterList(StringBuilder os);

    /**
     * 匿名参数的名字，index 从 1 开始。返回 null 表示只打印类型。
     */
    String anonymousParameterName(int index);
}
