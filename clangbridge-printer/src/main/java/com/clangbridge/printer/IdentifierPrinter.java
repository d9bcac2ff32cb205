package com.clangbridge.printer;

/**
 * 标识符合法化：把源语言中的名字转成目标方言中可用的标识符并写出。
 */
public interface IdentifierPrinter {

    void printIdentifier(StringBuilder os, String name);
}
