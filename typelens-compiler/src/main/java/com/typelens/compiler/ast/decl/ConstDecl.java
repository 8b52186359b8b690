package com.typelens.compiler.ast.decl;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Literal;
import com.typelens.compiler.ast.type.TypeRef;

/**
 * 带类型注解的常量: const name: Type = literal;
 */
public class ConstDecl extends Declaration {
    private final TypeRef type;
    private final Literal initializer;

    public ConstDecl(SourceLocation location, String name, TypeRef type, Literal initializer) {
        super(location, name);
        this.type = type;
        this.initializer = initializer;
    }

    public TypeRef getType() {
        return type;
    }

    public Literal getInitializer() {
        return initializer;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConstDecl(this, context);
    }
}
