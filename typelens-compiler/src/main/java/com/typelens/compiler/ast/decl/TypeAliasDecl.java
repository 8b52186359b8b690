package com.typelens.compiler.ast.decl;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 类型别名声明: type Name&lt;T, U&gt; = ...;
 */
public class TypeAliasDecl extends Declaration {
    private final List<String> typeParams;
    private final TypeRef aliasedType;

    public TypeAliasDecl(SourceLocation location, String name,
                         List<String> typeParams, TypeRef aliasedType) {
        super(location, name);
        this.typeParams = typeParams;
        this.aliasedType = aliasedType;
    }

    public List<String> getTypeParams() {
        return typeParams;
    }

    public boolean isGeneric() {
        return !typeParams.isEmpty();
    }

    public TypeRef getAliasedType() {
        return aliasedType;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeAliasDecl(this, context);
    }
}
