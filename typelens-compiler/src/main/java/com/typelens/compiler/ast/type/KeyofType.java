package com.typelens.compiler.ast.type;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;

/**
 * keyof T
 */
public final class KeyofType extends TypeRef {
    private final TypeRef target;

    public KeyofType(SourceLocation location, TypeRef target) {
        super(location);
        this.target = target;
    }

    public TypeRef getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitKeyofType(this, context);
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitKeyof(this);
    }
}
