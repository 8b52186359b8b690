package com.typelens.compiler.ast.type;

import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;

/**
 * 函数类型参数: name?: Type 或 ...name: Type[]
 */
public final class Parameter extends AstNode {
    private final String name;
    private final TypeRef type;
    private final boolean optional;
    private final boolean rest;

    public Parameter(SourceLocation location, String name, TypeRef type, boolean optional, boolean rest) {
        super(location);
        this.name = name;
        this.type = type;
        this.optional = optional;
        this.rest = rest;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isRest() {
        return rest;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
