package com.typelens.compiler.ast.type;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 对象类型字面量: { readonly a: number; b?: string; run(): void; [key: string]: T }
 */
public final class ObjectType extends TypeRef {
    private final List<PropertySignature> members;
    private final TypeRef indexType;    // 可选

    public ObjectType(SourceLocation location, List<PropertySignature> members, TypeRef indexType) {
        super(location);
        this.members = members;
        this.indexType = indexType;
    }

    public List<PropertySignature> getMembers() {
        return members;
    }

    public TypeRef getIndexType() {
        return indexType;
    }

    public boolean hasIndexSignature() {
        return indexType != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitObjectType(this, context);
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitObject(this);
    }
}
