package com.clangbridge.cli;

import com.clangbridge.types.OpaqueType;
import com.clangbridge.types.OptionalKind;
import com.clangbridge.types.TypeAliasType;
import com.clangbridge.types.TypeNode;
import com.clangbridge.types.Types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 把签名文件中的类型拼写解析为 (TypeNode, OptionalKind)。
 * <p>
 * 名字依次按 声明的别名 → 标准库类型 → 本模块具名类型 解析；
 * 末尾的 ? / ! 转为可选性；() 与 Void 为空元组；泛型、数组、函数类型等不透明处理。
 */
public class SourceTypeResolver {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern QUALIFIED = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)+");

    private final String module;
    private final Map<String, String> aliases;
    private final Map<String, TypeAliasType> resolvedAliases = new HashMap<>();
    private final Set<String> resolving = new HashSet<>();
    private final String source;

    public SourceTypeResolver(String module, Map<String, String> aliases, String source) {
        this.module = module;
        this.aliases = aliases != null ? aliases : Collections.<String, String>emptyMap();
        this.source = source;
    }

    public SourceTypeResolver(String module) {
        this(module, null, null);
    }

    /**
     * 解析一个类型拼写。
     */
    public ResolvedType resolve(String spelling) {
        if (spelling == null || spelling.trim().isEmpty()) {
            throw new InputFormatException("类型不能为空", source);
        }
        String text = spelling.trim();
        OptionalKind optionality = OptionalKind.NONE;
        if (text.endsWith("?")) {
            optionality = OptionalKind.OPTIONAL;
            text = text.substring(0, text.length() - 1).trim();
        } else if (text.endsWith("!")) {
            optionality = OptionalKind.IMPLICITLY_UNWRAPPED;
            text = text.substring(0, text.length() - 1).trim();
        }
        if (text.isEmpty()) {
            throw new InputFormatException("无效类型 '" + spelling + "'", source);
        }
        return new ResolvedType(resolveObjectType(text), optionality);
    }

    private TypeNode resolveObjectType(String text) {
        if (text.startsWith("(") && text.endsWith(")") && !text.contains("->")) {
            return resolveTuple(text.substring(1, text.length() - 1));
        }
        if (IDENTIFIER.matcher(text).matches()) {
            return resolveName(text);
        }
        if (QUALIFIED.matcher(text).matches()) {
            int dot = text.lastIndexOf('.');
            return Types.nominal(text.substring(0, dot), text.substring(dot + 1));
        }
        // 泛型实例、数组、字典、函数类型等
        return new OpaqueType(text);
    }

    private TypeNode resolveTuple(String body) {
        if (body.trim().isEmpty()) {
            return Types.EMPTY_TUPLE;
        }
        List<String> parts = splitTopLevel(body);
        if (parts.size() == 1) {
            // (T) 只是带括号的 T
            return resolveObjectType(parts.get(0));
        }
        List<TypeNode> elements = new ArrayList<>();
        for (String part : parts) {
            ResolvedType element = resolve(part);
            elements.add(element.getOptionality() == OptionalKind.NONE
                    ? element.getType()
                    : new OpaqueType(part.trim()));
        }
        return Types.tuple(elements.toArray(new TypeNode[0]));
    }

    private TypeNode resolveName(String name) {
        if (aliases.containsKey(name)) {
            return resolveAlias(name);
        }
        TypeNode stdlib = Types.fromStdlibName(name);
        if (stdlib != null) {
            return stdlib;
        }
        return Types.nominal(module, name);
    }

    private TypeAliasType resolveAlias(String name) {
        TypeAliasType cached = resolvedAliases.get(name);
        if (cached != null) return cached;
        if (!resolving.add(name)) {
            throw new InputFormatException("类型别名循环引用: " + name, source);
        }
        try {
            ResolvedType target = resolve(aliases.get(name));
            if (target.getOptionality() != OptionalKind.NONE) {
                throw new InputFormatException("类型别名 '" + name + "' 不能指向可选类型 '"
                        + aliases.get(name) + "'", source);
            }
            TypeAliasType alias = Types.alias(module, name, target.getType());
            resolvedAliases.put(name, alias);
            return alias;
        } finally {
            resolving.remove(name);
        }
    }

    /** 按顶层逗号拆分，忽略 () <> [] 内部的逗号 */
    static List<String> splitTopLevel(String body) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '(' || c == '<' || c == '[') {
                depth++;
            } else if (c == ')' || c == '>' || c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(body.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(body.substring(start).trim());
        return parts;
    }
}
