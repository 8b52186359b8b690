package com.typelens.compiler.ast.type;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 联合类型 A | B
 */
public final class UnionType extends TypeRef {
    private final List<TypeRef> alternatives;

    public UnionType(SourceLocation location, List<TypeRef> alternatives) {
        super(location);
        this.alternatives = alternatives;
    }

    public List<TypeRef> getAlternatives() {
        return alternatives;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnionType(this, context);
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitUnion(this);
    }
}
