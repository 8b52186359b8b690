package com.typelens.compiler.ast;

import com.typelens.compiler.ast.decl.*;
import com.typelens.compiler.ast.expr.Literal;
import com.typelens.compiler.ast.type.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitProgram(Program node, C ctx) { return null; }

    default R visitTypeAliasDecl(TypeAliasDecl node, C ctx) { return null; }

    default R visitConstDecl(ConstDecl node, C ctx) { return null; }

    default R visitAssertDecl(AssertDecl node, C ctx) { return null; }

    // ============ 值 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    // ============ 类型 ============

    default R visitSimpleType(SimpleType node, C ctx) { return null; }

    default R visitGenericType(GenericType node, C ctx) { return null; }

    default R visitLiteralType(LiteralType node, C ctx) { return null; }

    default R visitObjectType(ObjectType node, C ctx) { return null; }

    default R visitPropertySignature(PropertySignature node, C ctx) { return null; }

    default R visitFunctionType(FunctionType node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    default R visitArrayType(ArrayType node, C ctx) { return null; }

    default R visitUnionType(UnionType node, C ctx) { return null; }

    default R visitIntersectionType(IntersectionType node, C ctx) { return null; }

    default R visitKeyofType(KeyofType node, C ctx) { return null; }

    default R visitIndexedAccessType(IndexedAccessType node, C ctx) { return null; }
}
