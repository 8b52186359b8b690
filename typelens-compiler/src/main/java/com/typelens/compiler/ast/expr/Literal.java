package com.typelens.compiler.ast.expr;

import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.SourceLocation;

/**
 * 值字面量（const 初始化器）
 */
public class Literal extends AstNode {
    private final String text;
    private final LiteralKind kind;

    public Literal(SourceLocation location, String text, LiteralKind kind) {
        super(location);
        this.text = text;
        this.kind = kind;
    }

    /** NUMBER 为规范文本，STRING 为内容，BOOLEAN 为 "true"/"false" */
    public String getText() {
        return text;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        NUMBER,
        STRING,
        BOOLEAN,
        NULL,
        UNDEFINED
    }
}
