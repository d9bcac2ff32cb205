package com.clangbridge.types;

/**
 * TypeNode 访问者接口，每个变体一个方法。
 */
public interface TypeNodeVisitor<R> {
    R visitNominal(NominalType type, OptionalKind optionalKind);
    R visitAlias(TypeAliasType type, OptionalKind optionalKind);
    R visitTuple(TupleType type, OptionalKind optionalKind);
    R visitOpaque(OpaqueType type, OptionalKind optionalKind);
}
