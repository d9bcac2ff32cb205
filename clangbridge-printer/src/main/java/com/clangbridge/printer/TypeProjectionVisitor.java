package com.clangbridge.printer;

import com.clangbridge.types.NominalDecl;
import com.clangbridge.types.NominalType;
import com.clangbridge.types.OpaqueType;
import com.clangbridge.types.OptionalKind;
import com.clangbridge.types.TupleType;
import com.clangbridge.types.TypeAliasType;
import com.clangbridge.types.TypeNode;
import com.clangbridge.types.TypeNodeVisitor;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 把 (TypeNode, OptionalKind) 规约为目标方言的类型文本。
 * <p>
 * 已知类型查表输出；别名先查别名自身，查不到再剥掉一层并携带同一个可选性递归；
 * 空元组输出 void；未知具名类型和不透明类型得到 "无法表示"，由调用方渲染为占位注释。
 * 非空元组说明上游没有把多值参数拆开，直接抛出 {@link ContractViolationException}。
 */
public class TypeProjectionVisitor implements TypeNodeVisitor<TypeProjection> {

    private static final Logger LOG = Logger.getLogger(TypeProjectionVisitor.class.getName());

    private final DialectPolicy policy;

    public TypeProjectionVisitor(DialectPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public TypeProjection project(TypeNode type, OptionalKind optionalKind) {
        if (type == null) {
            throw new ContractViolationException("类型节点为 null");
        }
        return type.accept(this, optionalKind != null ? optionalKind : OptionalKind.NONE);
    }

    @Override
    public TypeProjection visitNominal(NominalType type, OptionalKind optionalKind) {
        TypeProjection known = projectIfKnownSimpleType(type.getDecl(), optionalKind);
        if (known != null) return known;
        // TODO: 结构体等聚合类型需要先生成对应的 C 结构声明才能引用
        return unrepresentable(type);
    }

    @Override
    public TypeProjection visitAlias(TypeAliasType type, OptionalKind optionalKind) {
        TypeProjection known = projectIfKnownSimpleType(type.getDecl(), optionalKind);
        if (known != null) return known;

        TypeNode underlying = type.getSinglyDesugaredType();
        if (underlying == null) {
            throw new ContractViolationException("类型别名 '" + type.getDecl() + "' 缺少底层类型");
        }
        return underlying.accept(this, optionalKind);
    }

    @Override
    public TypeProjection visitTuple(TupleType type, OptionalKind optionalKind) {
        if (!type.isEmpty()) {
            throw new ContractViolationException("多元素元组 " + type.getDescription()
                    + " 应在上游拆分为独立的参数或返回值");
        }
        return TypeProjection.ok("void");
    }

    @Override
    public TypeProjection visitOpaque(OpaqueType type, OptionalKind optionalKind) {
        return unrepresentable(type);
    }

    private TypeProjection projectIfKnownSimpleType(NominalDecl decl, OptionalKind optionalKind) {
        Optional<KnownTypeInfo> info = policy.lookup(decl);
        if (!info.isPresent()) return null;

        KnownTypeInfo known = info.get();
        if (known.canBeNullable()) {
            return TypeProjection.ok(policy.annotate(known.getName(), optionalKind));
        }
        if (optionalKind.isOptional()) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("丢弃可选性: " + decl + " → " + known.getName()
                        + " (" + policy.getMode().getKey() + ")");
            }
            return TypeProjection.okDroppingOptionality(known.getName());
        }
        return TypeProjection.ok(known.getName());
    }

    private TypeProjection unrepresentable(TypeNode type) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("无法在 " + policy.getMode().getKey() + " 中表示类型: " + type.getDescription());
        }
        return TypeProjection.unrepresentable(type.getDescription());
    }
}
