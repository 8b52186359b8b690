package com.typelens.compiler.ast.type;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;

/**
 * 索引访问类型 T["key"]
 */
public final class IndexedAccessType extends TypeRef {
    private final TypeRef objectType;
    private final TypeRef indexType;

    public IndexedAccessType(SourceLocation location, TypeRef objectType, TypeRef indexType) {
        super(location);
        this.objectType = objectType;
        this.indexType = indexType;
    }

    public TypeRef getObjectType() {
        return objectType;
    }

    public TypeRef getIndexType() {
        return indexType;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexedAccessType(this, context);
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitIndexedAccess(this);
    }
}
