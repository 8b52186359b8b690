package com.typelens.compiler.ast.decl;

import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 程序（编译单元）
 */
public class Program extends AstNode {
    private final List<Declaration> declarations;

    public Program(SourceLocation location, List<Declaration> declarations) {
        super(location);
        this.declarations = declarations;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
