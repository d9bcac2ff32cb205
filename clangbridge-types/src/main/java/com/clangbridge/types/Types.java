package com.clangbridge.types;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 预定义类型常量和工厂方法。
 */
public final class Types {

    private Types() {}

    /** 标准库模块名 */
    public static final String STDLIB_MODULE = "Swift";

    // 标准库标量
    public static final NominalType BOOL = stdlib("Bool");
    public static final NominalType INT = stdlib("Int");
    public static final NominalType UINT = stdlib("UInt");
    public static final NominalType INT8 = stdlib("Int8");
    public static final NominalType INT16 = stdlib("Int16");
    public static final NominalType INT32 = stdlib("Int32");
    public static final NominalType INT64 = stdlib("Int64");
    public static final NominalType UINT8 = stdlib("UInt8");
    public static final NominalType UINT16 = stdlib("UInt16");
    public static final NominalType UINT32 = stdlib("UInt32");
    public static final NominalType UINT64 = stdlib("UInt64");
    public static final NominalType FLOAT = stdlib("Float");
    public static final NominalType DOUBLE = stdlib("Double");

    // 指针
    public static final NominalType OPAQUE_POINTER = stdlib("OpaquePointer");
    public static final NominalType UNSAFE_RAW_POINTER = stdlib("UnsafeRawPointer");
    public static final NominalType UNSAFE_MUTABLE_RAW_POINTER = stdlib("UnsafeMutableRawPointer");

    // 特殊类型
    public static final TupleType EMPTY_TUPLE = new TupleType(Collections.<TypeNode>emptyList());
    /** Void 是空元组的别名 */
    public static final TypeAliasType VOID = alias(STDLIB_MODULE, "Void", EMPTY_TUPLE);

    // C 互操作别名
    public static final TypeAliasType FLOAT32 = alias(STDLIB_MODULE, "Float32", FLOAT);
    public static final TypeAliasType FLOAT64 = alias(STDLIB_MODULE, "Float64", DOUBLE);
    public static final TypeAliasType CBOOL = alias(STDLIB_MODULE, "CBool", BOOL);
    public static final TypeAliasType CCHAR = alias(STDLIB_MODULE, "CChar", INT8);
    public static final TypeAliasType CSHORT = alias(STDLIB_MODULE, "CShort", INT16);
    public static final TypeAliasType CINT = alias(STDLIB_MODULE, "CInt", INT32);
    public static final TypeAliasType CUNSIGNED_INT = alias(STDLIB_MODULE, "CUnsignedInt", UINT32);
    public static final TypeAliasType CLONG = alias(STDLIB_MODULE, "CLong", INT);
    public static final TypeAliasType CLONG_LONG = alias(STDLIB_MODULE, "CLongLong", INT64);
    public static final TypeAliasType CFLOAT = alias(STDLIB_MODULE, "CFloat", FLOAT);
    public static final TypeAliasType CDOUBLE = alias(STDLIB_MODULE, "CDouble", DOUBLE);

    /** 标准库中具名的类型与别名，按名字索引 */
    private static final Map<String, TypeNode> STDLIB_TYPES = new LinkedHashMap<>();

    static {
        for (NominalType t : Arrays.asList(BOOL, INT, UINT, INT8, INT16, INT32, INT64,
                UINT8, UINT16, UINT32, UINT64, FLOAT, DOUBLE,
                OPAQUE_POINTER, UNSAFE_RAW_POINTER, UNSAFE_MUTABLE_RAW_POINTER)) {
            STDLIB_TYPES.put(t.getDecl().getName(), t);
        }
        for (TypeAliasType t : Arrays.asList(VOID, FLOAT32, FLOAT64, CBOOL, CCHAR, CSHORT,
                CINT, CUNSIGNED_INT, CLONG, CLONG_LONG, CFLOAT, CDOUBLE)) {
            STDLIB_TYPES.put(t.getDecl().getName(), t);
        }
    }

    /** 创建标准库中的具名类型 */
    public static NominalType stdlib(String name) {
        return new NominalType(new NominalDecl(STDLIB_MODULE, name));
    }

    /** 创建指定模块中的具名类型 */
    public static NominalType nominal(String module, String name) {
        return new NominalType(new NominalDecl(module, name));
    }

    /** 创建类型别名 */
    public static TypeAliasType alias(NominalDecl decl, TypeNode underlying) {
        return new TypeAliasType(decl, underlying);
    }

    /** 创建类型别名，别名声明位于指定模块 */
    public static TypeAliasType alias(String module, String name, TypeNode underlying) {
        return new TypeAliasType(new NominalDecl(module, name), underlying);
    }

    /** 创建元组；无元素时返回共享的空元组 */
    public static TupleType tuple(TypeNode... elements) {
        if (elements.length == 0) return EMPTY_TUPLE;
        return new TupleType(Arrays.asList(elements));
    }

    /** 创建不透明类型 */
    public static OpaqueType opaque(String description) {
        return new OpaqueType(description);
    }

    /** 根据名字查找标准库类型或别名，未登记返回 null */
    public static TypeNode fromStdlibName(String name) {
        return STDLIB_TYPES.get(name);
    }
}
