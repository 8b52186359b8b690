package com.typelens.compiler.ast.type;

import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;

/**
 * 对象类型中的成员声明: readonly name?: Type 或方法签名 name(params): Ret
 */
public final class PropertySignature extends AstNode {
    private final String name;
    private final TypeRef type;     // 方法签名时为 FunctionType
    private final boolean readonly;
    private final boolean optional;
    private final boolean method;

    public PropertySignature(SourceLocation location, String name, TypeRef type,
                             boolean readonly, boolean optional, boolean method) {
        super(location);
        this.name = name;
        this.type = type;
        this.readonly = readonly;
        this.optional = optional;
        this.method = method;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public boolean isReadonly() {
        return readonly;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isMethod() {
        return method;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPropertySignature(this, context);
    }
}
