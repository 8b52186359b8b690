package com.typelens.compiler.ast.type;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;

/**
 * 数组类型 T[] / readonly T[]
 */
public final class ArrayType extends TypeRef {
    private final TypeRef elementType;
    private final boolean readonly;

    public ArrayType(SourceLocation location, TypeRef elementType, boolean readonly) {
        super(location);
        this.elementType = elementType;
        this.readonly = readonly;
    }

    public TypeRef getElementType() {
        return elementType;
    }

    public boolean isReadonly() {
        return readonly;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayType(this, context);
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitArray(this);
    }
}
