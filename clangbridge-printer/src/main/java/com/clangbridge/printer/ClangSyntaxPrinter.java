package com.clangbridge.printer;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * C 家族语法的小工具：标识符转义和占位注释。
 */
public class ClangSyntaxPrinter implements IdentifierPrinter {

    /** C、C++ 与 Objective-C 保留字 */
    private static final Set<String> KEYWORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            // C
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double",
            "else", "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long",
            "register", "restrict", "return", "short", "signed", "sizeof", "static", "struct",
            "switch", "typedef", "union", "unsigned", "void", "volatile", "while",
            "_Alignas", "_Alignof", "_Atomic", "_Bool", "_Complex", "_Generic", "_Imaginary",
            "_Noreturn", "_Static_assert", "_Thread_local",
            // C++
            "alignas", "alignof", "and", "and_eq", "asm", "bitand", "bitor", "bool", "catch",
            "char8_t", "char16_t", "char32_t", "class", "co_await", "co_return", "co_yield",
            "compl", "concept", "const_cast", "consteval", "constexpr", "constinit", "decltype",
            "delete", "dynamic_cast", "explicit", "export", "false", "friend", "mutable",
            "namespace", "new", "noexcept", "not", "not_eq", "nullptr", "operator", "or",
            "or_eq", "private", "protected", "public", "reinterpret_cast", "requires",
            "static_assert", "static_cast", "template", "this", "thread_local", "throw", "true",
            "try", "typeid", "typename", "using", "virtual", "wchar_t", "xor", "xor_eq",
            // Objective-C
            "id", "self", "super", "nil", "Nil", "YES", "NO", "BOOL", "SEL", "IMP",
            "in", "out", "inout", "bycopy", "byref", "oneway")));

    public static boolean isClangKeyword(String name) {
        return KEYWORDS.contains(name);
    }

    /**
     * 非法字符替换为 '_'，数字开头加 '_' 前缀，保留字追加 '_' 后缀。
     */
    @Override
    public void printIdentifier(StringBuilder os, String name) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("标识符不能为空");
        }
        StringBuilder legal = new StringBuilder(name.length() + 1);
        if (Character.isDigit(name.charAt(0))) {
            legal.append('_');
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean ok = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                    || (c >= '0' && c <= '9') || c == '_';
            legal.append(ok ? c : '_');
        }
        os.append(legal);
        if (isClangKeyword(legal.toString())) {
            os.append('_');
        }
    }

    /**
     * 写出惰性占位注释 "/* description *&#47;"。
     * 描述里的 "*&#47;" 会被拆开，换行折成空格，占位始终是单行注释。
     */
    public static void printPlaceholderComment(StringBuilder os, String description) {
        String text = description.replace("*/", "* /").replaceAll("\\r\\n|[\\r\\n]", " ");
        os.append("/* ").append(text).append(" */");
    }
}
