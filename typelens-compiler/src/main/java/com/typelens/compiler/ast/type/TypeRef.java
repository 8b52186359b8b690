package com.typelens.compiler.ast.type;

import com.typelens.compiler.analysis.types.LensType;
import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.SourceLocation;

/**
 * 类型引用基类
 */
public abstract class TypeRef extends AstNode {
    // 语义分析后解析的结构化类型
    protected LensType resolvedType;

    protected TypeRef(SourceLocation location) {
        super(location);
    }

    public LensType getResolvedType() {
        return resolvedType;
    }

    public void setResolvedType(LensType type) {
        this.resolvedType = type;
    }

    /** 接受轻量 TypeRefVisitor 进行类型引用分派 */
    public abstract <R> R accept(TypeRefVisitor<R> visitor);
}
