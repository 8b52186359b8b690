package com.typelens.compiler.ast.decl;

import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.SourceLocation;

/**
 * 顶层声明基类
 */
public abstract class Declaration extends AstNode {
    protected final String name;    // assert 声明为 null

    protected Declaration(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
