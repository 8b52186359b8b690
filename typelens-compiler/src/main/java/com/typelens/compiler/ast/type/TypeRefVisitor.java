package com.typelens.compiler.ast.type;

/**
 * TypeRef 轻量访问者接口，用于替代 instanceof 分派。
 */
public interface TypeRefVisitor<R> {
    R visitSimple(SimpleType type);
    R visitGeneric(GenericType type);
    R visitLiteral(LiteralType type);
    R visitObject(ObjectType type);
    R visitFunction(FunctionType type);
    R visitArray(ArrayType type);
    R visitUnion(UnionType type);
    R visitIntersection(IntersectionType type);
    R visitKeyof(KeyofType type);
    R visitIndexedAccess(IndexedAccessType type);
}
