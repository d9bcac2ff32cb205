package com.clangbridge.printer;

/**
 * 上游契约被破坏（非空元组、残缺的类型节点等）。属于编程错误，打印器不会捕获它。
 */
public class ContractViolationException extends IllegalStateException {

    public ContractViolationException(String message) {
        super(message);
    }
}
