package com.typelens.compiler.analysis.types;

/**
 * LensType 访问者接口，用于替代 instanceof 分派。
 */
public interface LensTypeVisitor<R> {
    R visitPrimitive(PrimitiveLensType type);
    R visitLiteral(LiteralLensType type);
    R visitObject(ObjectLensType type);
    R visitFunction(FunctionLensType type);
    R visitArray(ArrayLensType type);
    R visitUnion(UnionLensType type);
    R visitAny(AnyType type);
    R visitNever(NeverType type);
    R visitError(ErrorType type);
}
