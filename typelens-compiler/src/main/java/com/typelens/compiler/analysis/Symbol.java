package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.types.LensType;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.decl.Declaration;

/**
 * 符号表中的符号
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final SourceLocation location; // 声明位置
    private final Declaration declaration; // 声明的 AST 节点

    // 别名求值结果 / 常量的声明类型；泛型别名为 null
    private LensType resolvedType;

    public Symbol(String name, SymbolKind kind, SourceLocation location, Declaration declaration) {
        this.name = name;
        this.kind = kind;
        this.location = location;
        this.declaration = declaration;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public SourceLocation getLocation() { return location; }
    public Declaration getDeclaration() { return declaration; }

    public LensType getResolvedType() { return resolvedType; }
    public void setResolvedType(LensType type) { this.resolvedType = type; }

    @Override
    public String toString() {
        return kind + " " + name;
    }
}
