package com.typelens.compiler.ast.type;

import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 函数类型 (a: A, b?: B) =&gt; R，或构造签名 new (...args: any[]) =&gt; R
 */
public final class FunctionType extends TypeRef {
    private final List<Parameter> params;
    private final TypeRef returnType;
    private final boolean constructor;

    public FunctionType(SourceLocation location, List<Parameter> params,
                        TypeRef returnType, boolean constructor) {
        super(location);
        this.params = params;
        this.returnType = returnType;
        this.constructor = constructor;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public boolean isConstructor() {
        return constructor;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionType(this, context);
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
