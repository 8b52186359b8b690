package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.classify.ClassifierOptions;
import com.typelens.compiler.analysis.classify.NumericLiteralClassifier;
import com.typelens.compiler.analysis.types.*;
import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.decl.*;
import com.typelens.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 形状分析器：遍历声明构建符号表、求值类型别名并检查 const / assert。
 *
 * <p>类型别名先全部登记（提升），因此声明顺序不影响引用。
 * 类型求值委托给 {@link TypeResolver}，工具类型委托给 {@link UtilityTypes}。</p>
 *
 * <p>实例只用于一次分析，不可在线程间共享。</p>
 */
public final class ShapeAnalyzer implements AstVisitor<Void, Void> {

    private static final Logger LOG = Logger.getLogger(ShapeAnalyzer.class.getName());

    private final SymbolTable symbolTable = new SymbolTable();
    private final List<SemanticDiagnostic> diagnostics = new ArrayList<SemanticDiagnostic>();
    private final Map<String, LensType> evaluatedAliases = new LinkedHashMap<String, LensType>();
    private final TypeResolver typeResolver;

    public ShapeAnalyzer(ClassifierOptions options) {
        UtilityTypes utilities = new UtilityTypes(new NumericLiteralClassifier(options));
        this.typeResolver = new TypeResolver(utilities, diagnostics);
    }

    public ShapeAnalyzer() {
        this(new ClassifierOptions());
    }

    /** 分析入口 */
    public AnalysisResult analyze(Program program) {
        program.accept(this, null);
        return result();
    }

    /**
     * 在已分析的声明环境中求值一个独立的类型表达式（REPL 使用）。
     * 求值产生的诊断追加到 {@link #getDiagnostics()}。
     */
    public LensType evaluate(TypeRef type) {
        return typeResolver.resolve(type);
    }

    public List<SemanticDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public AnalysisResult result() {
        return new AnalysisResult(symbolTable, new ArrayList<SemanticDiagnostic>(diagnostics),
                new LinkedHashMap<String, LensType>(evaluatedAliases));
    }

    // ============ 声明 ============

    @Override
    public Void visitProgram(Program node, Void ctx) {
        // 第一遍：登记所有类型别名
        for (Declaration decl : node.getDeclarations()) {
            if (decl instanceof TypeAliasDecl) {
                declareAlias((TypeAliasDecl) decl);
            }
        }
        // 第二遍：按声明顺序求值与检查
        for (Declaration decl : node.getDeclarations()) {
            decl.accept(this, null);
        }
        LOG.fine("analyzed " + node.getDeclarations().size() + " declarations, "
                + diagnostics.size() + " diagnostics");
        return null;
    }

    private void declareAlias(TypeAliasDecl decl) {
        String name = decl.getName();
        if (LensTypes.fromName(name) != null) {
            addDiagnostic(SemanticDiagnostic.Severity.ERROR, "不能使用内置类型名 '" + name + "' 作为别名", decl);
            return;
        }
        Symbol symbol = new Symbol(name, SymbolKind.TYPE_ALIAS, decl.getLocation(), decl);
        Symbol existing = symbolTable.define(symbol);
        if (existing != null) {
            addDiagnostic(SemanticDiagnostic.Severity.ERROR, "类型别名 '" + name
                    + "' 重复定义（首次定义于第 " + existing.getLocation().getLine() + " 行）", decl);
            return;
        }
        typeResolver.registerAlias(decl);
        if (UtilityTypes.isUtility(name)) {
            addDiagnostic(SemanticDiagnostic.Severity.WARNING,
                    "类型别名 '" + name + "' 遮蔽了同名内置工具类型", decl);
        }
    }

    @Override
    public Void visitTypeAliasDecl(TypeAliasDecl node, Void ctx) {
        Symbol symbol = symbolTable.lookup(node.getName(), SymbolKind.TYPE_ALIAS);
        // 重复定义或非法名称的声明不求值
        if (symbol == null || symbol.getDeclaration() != node) return null;

        if (node.isGeneric()) {
            typeResolver.checkReferences(node);
            return null;
        }
        LensType type = typeResolver.resolveAlias(node.getName(), node);
        symbol.setResolvedType(type);
        evaluatedAliases.put(node.getName(), type);
        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer("type " + node.getName() + " = " + type.toDisplayString());
        }
        return null;
    }

    @Override
    public Void visitConstDecl(ConstDecl node, Void ctx) {
        Symbol symbol = new Symbol(node.getName(), SymbolKind.CONST, node.getLocation(), node);
        Symbol existing = symbolTable.define(symbol);
        if (existing != null) {
            addDiagnostic(SemanticDiagnostic.Severity.ERROR, "常量 '" + node.getName()
                    + "' 重复定义（首次定义于第 " + existing.getLocation().getLine() + " 行）", node);
            return null;
        }

        LensType declared = typeResolver.resolve(node.getType());
        symbol.setResolvedType(declared);
        if (declared instanceof ErrorType) return null;

        if (declared instanceof NeverType) {
            addDiagnostic(SemanticDiagnostic.Severity.ERROR,
                    "常量 '" + node.getName() + "' 的类型为 never，没有值可以赋给它", node.getType());
            return null;
        }
        LensType value = TypeResolver.literalType(node.getInitializer());
        if (!TypeCompatibility.isAssignable(declared, value)) {
            addDiagnostic(SemanticDiagnostic.Severity.ERROR, "类型 '" + value.toDisplayString()
                    + "' 不能赋给类型 '" + declared.toDisplayString() + "'", node.getInitializer());
        }
        return null;
    }

    @Override
    public Void visitAssertDecl(AssertDecl node, Void ctx) {
        LensType result = typeResolver.resolve(node.getCondition());
        if (result instanceof ErrorType) return null;
        if (!LensTypes.TRUE.equals(result)) {
            addDiagnostic(SemanticDiagnostic.Severity.ERROR,
                    "断言失败: 类型求值为 '" + result.toDisplayString() + "'，期望 'true'", node.getCondition());
        }
        return null;
    }

    /** 报告诊断 */
    private void addDiagnostic(SemanticDiagnostic.Severity severity, String message, AstNode node) {
        diagnostics.add(new SemanticDiagnostic(severity, message, node != null ? node.getLocation() : null));
    }
}
