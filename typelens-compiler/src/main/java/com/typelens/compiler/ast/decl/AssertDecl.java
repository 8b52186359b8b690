package com.typelens.compiler.ast.decl;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.type.TypeRef;

/**
 * 类型断言: assert Type; 要求 Type 求值为字面量 true
 */
public class AssertDecl extends Declaration {
    private final TypeRef condition;

    public AssertDecl(SourceLocation location, TypeRef condition) {
        super(location, null);
        this.condition = condition;
    }

    public TypeRef getCondition() {
        return condition;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssertDecl(this, context);
    }
}
