package com.clangbridge.printer;

import com.clangbridge.types.NominalDecl;
import com.clangbridge.types.Types;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 Map 的已知类型表，每个输出模式一个分区。构造后不可变。
 */
public final class PrimitiveTypeMapping implements TypeMapping {

    private final Map<OutputLanguageMode, Map<NominalDecl, KnownTypeInfo>> partitions;

    private PrimitiveTypeMapping(Map<OutputLanguageMode, Map<NominalDecl, KnownTypeInfo>> partitions) {
        Map<OutputLanguageMode, Map<NominalDecl, KnownTypeInfo>> copy = new EnumMap<>(OutputLanguageMode.class);
        for (OutputLanguageMode mode : OutputLanguageMode.values()) {
            Map<NominalDecl, KnownTypeInfo> entries = partitions.get(mode);
            copy.put(mode, entries == null
                    ? Collections.<NominalDecl, KnownTypeInfo>emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
        }
        this.partitions = copy;
    }

    @Override
    public Optional<KnownTypeInfo> lookup(NominalDecl decl, OutputLanguageMode mode) {
        if (decl == null || mode == null) return Optional.empty();
        return Optional.ofNullable(partitions.get(mode).get(decl));
    }

    /** 某个分区的全部条目（按登记顺序） */
    public Map<NominalDecl, KnownTypeInfo> getEntries(OutputLanguageMode mode) {
        return partitions.get(mode);
    }

    /** 所有分区的条目总数 */
    public int size() {
        int n = 0;
        for (Map<NominalDecl, KnownTypeInfo> entries : partitions.values()) {
            n += entries.size();
        }
        return n;
    }

    /** 以当前表为基础继续登记 */
    public Builder toBuilder() {
        Builder builder = new Builder();
        for (Map.Entry<OutputLanguageMode, Map<NominalDecl, KnownTypeInfo>> e : partitions.entrySet()) {
            for (Map.Entry<NominalDecl, KnownTypeInfo> entry : e.getValue().entrySet()) {
                builder.put(e.getKey(), entry.getKey(), entry.getValue());
            }
        }
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PrimitiveTypeMapping empty() {
        return new Builder().build();
    }

    /**
     * 标准库标量与指针的默认映射。
     * <p>
     * 标量一律不可空；只有指针类型能承载 _Nullable 等标注。
     * OBJC 与 C 的差异在 Bool / Int / UInt，CXX 与 C 的差异在 Int / UInt。
     */
    public static PrimitiveTypeMapping createDefault() {
        Builder builder = new Builder();

        builder.scalar("Bool", "bool");
        builder.scalar("Int8", "int8_t");
        builder.scalar("Int16", "int16_t");
        builder.scalar("Int32", "int32_t");
        builder.scalar("Int64", "int64_t");
        builder.scalar("UInt8", "uint8_t");
        builder.scalar("UInt16", "uint16_t");
        builder.scalar("UInt32", "uint32_t");
        builder.scalar("UInt64", "uint64_t");
        builder.scalar("Float", "float");
        builder.scalar("Double", "double");
        builder.scalar("Float32", "float");
        builder.scalar("Float64", "double");
        builder.scalar("Int", "ptrdiff_t");
        builder.scalar("UInt", "size_t");

        builder.scalar("CBool", "bool");
        builder.scalar("CChar", "char");
        builder.scalar("CShort", "short");
        builder.scalar("CInt", "int");
        builder.scalar("CUnsignedInt", "unsigned int");
        builder.scalar("CLong", "long");
        builder.scalar("CLongLong", "long long");
        builder.scalar("CFloat", "float");
        builder.scalar("CDouble", "double");

        builder.pointer("OpaquePointer", "void *");
        builder.pointer("UnsafeRawPointer", "void const *");
        builder.pointer("UnsafeMutableRawPointer", "void *");

        // 各方言的差异项覆盖上面的公共项
        builder.put(OutputLanguageMode.OBJC, stdlib("Bool"), new KnownTypeInfo("BOOL", false));
        builder.put(OutputLanguageMode.OBJC, stdlib("Int"), new KnownTypeInfo("NSInteger", false));
        builder.put(OutputLanguageMode.OBJC, stdlib("UInt"), new KnownTypeInfo("NSUInteger", false));
        builder.put(OutputLanguageMode.CXX, stdlib("Int"), new KnownTypeInfo("swift::Int", false));
        builder.put(OutputLanguageMode.CXX, stdlib("UInt"), new KnownTypeInfo("swift::UInt", false));

        return builder.build();
    }

    private static NominalDecl stdlib(String name) {
        return new NominalDecl(Types.STDLIB_MODULE, name);
    }

    /**
     * 表构建器。同一分区内后登记的条目覆盖先登记的。
     */
    public static final class Builder {

        private final Map<OutputLanguageMode, Map<NominalDecl, KnownTypeInfo>> partitions =
                new EnumMap<>(OutputLanguageMode.class);

        private Builder() {
        }

        public Builder put(OutputLanguageMode mode, NominalDecl decl, KnownTypeInfo info) {
            Map<NominalDecl, KnownTypeInfo> entries = partitions.get(mode);
            if (entries == null) {
                entries = new LinkedHashMap<>();
                partitions.put(mode, entries);
            }
            entries.put(decl, info);
            return this;
        }

        /** 在所有分区登记同一个目标名 */
        public Builder putAll(NominalDecl decl, KnownTypeInfo info) {
            for (OutputLanguageMode mode : OutputLanguageMode.values()) {
                put(mode, decl, info);
            }
            return this;
        }

        /** 标准库中不可空的标量 */
        public Builder scalar(String stdlibName, String targetName) {
            return putAll(stdlib(stdlibName), new KnownTypeInfo(targetName, false));
        }

        /** 标准库中可空的指针 */
        public Builder pointer(String stdlibName, String targetName) {
            return putAll(stdlib(stdlibName), new KnownTypeInfo(targetName, true));
        }

        public PrimitiveTypeMapping build() {
            return new PrimitiveTypeMapping(partitions);
        }
    }
}
