package com.typelens.compiler.ast.type;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 交叉类型 A &amp; B（仅支持对象形状）
 */
public final class IntersectionType extends TypeRef {
    private final List<TypeRef> parts;

    public IntersectionType(SourceLocation location, List<TypeRef> parts) {
        super(location);
        this.parts = parts;
    }

    public List<TypeRef> getParts() {
        return parts;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIntersectionType(this, context);
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitIntersection(this);
    }
}
