package com.typelens.compiler.ast.type;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Literal;

/**
 * 字面量类型（如 5、-3.5、"a"、true、null）
 */
public final class LiteralType extends TypeRef {
    private final Literal literal;

    public LiteralType(SourceLocation location, Literal literal) {
        super(location);
        this.literal = literal;
    }

    public Literal getLiteral() {
        return literal;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteralType(this, context);
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
