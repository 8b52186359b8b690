package com.typelens.compiler.ast.type;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 带类型参数的引用（如 ReadonlyKeys&lt;Shape&gt;、Pick&lt;T, "a"&gt;）
 */
public final class GenericType extends TypeRef {
    private final String name;
    private final List<TypeRef> typeArgs;

    public GenericType(SourceLocation location, String name, List<TypeRef> typeArgs) {
        super(location);
        this.name = name;
        this.typeArgs = typeArgs;
    }

    public String getName() {
        return name;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGenericType(this, context);
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitGeneric(this);
    }
}
