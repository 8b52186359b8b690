package com.typelens.cli;

import com.typelens.compiler.analysis.AnalysisResult;
import com.typelens.compiler.analysis.SemanticDiagnostic;
import com.typelens.compiler.analysis.ShapeAnalyzer;
import com.typelens.compiler.analysis.Symbol;
import com.typelens.compiler.analysis.SymbolKind;
import com.typelens.compiler.analysis.classify.ClassifierOptions;
import com.typelens.compiler.analysis.types.LensType;
import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.decl.*;
import com.typelens.compiler.ast.type.TypeRef;
import com.typelens.compiler.lexer.Lexer;
import com.typelens.compiler.parser.ParseException;
import com.typelens.compiler.parser.Parser;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * REPL 会话状态：累积已接受的声明，每次输入都在完整环境中重新分析。
 *
 * <p>使整个环境产生 ERROR 的声明不会被接受，包括破坏已有声明的重新声明；
 * 同名的类型别名或常量重新声明时替换旧声明。</p>
 */
public class ReplSession {

    private final ClassifierOptions options;
    private final PrintStream err;
    private final List<Declaration> declarations = new ArrayList<Declaration>();
    private int inputCounter = 0;

    public ReplSession(ClassifierOptions options, PrintStream err) {
        this.options = options;
        this.err = err;
    }

    /**
     * 处理一次输入（声明或裸类型表达式）
     *
     * @return 要打印的输出行
     */
    public List<String> evaluate(String input) {
        List<String> output = new ArrayList<String>();
        String fileName = "<input#" + (++inputCounter) + ">";

        AstNode node;
        try {
            Parser parser = new Parser(new Lexer(input, fileName, err), fileName);
            node = parser.parseReplInput();
        } catch (ParseException e) {
            output.add("错误: " + e.getMessage());
            return output;
        }
        if (node == null) return output;

        if (node instanceof Declaration) {
            declare((Declaration) node, fileName, output);
        } else {
            evaluateType((TypeRef) node, fileName, output);
        }
        return output;
    }

    private void declare(Declaration decl, String fileName, List<String> output) {
        List<Declaration> candidate = new ArrayList<Declaration>(declarations);
        removeSameName(candidate, decl);
        candidate.add(decl);

        ShapeAnalyzer analyzer = new ShapeAnalyzer(options);
        AnalysisResult result = analyzer.analyze(program(candidate));
        if (report(result.getDiagnostics(), fileName, output)) return;

        declarations.clear();
        declarations.addAll(candidate);

        if (decl instanceof TypeAliasDecl) {
            TypeAliasDecl alias = (TypeAliasDecl) decl;
            if (alias.isGeneric()) {
                output.add("type " + alias.getName() + "<" + String.join(", ", alias.getTypeParams()) + "> 已定义");
            } else {
                output.add("type " + alias.getName() + " = "
                        + result.getAliasType(alias.getName()).toDisplayString());
            }
        } else if (decl instanceof ConstDecl) {
            Symbol symbol = result.getSymbolTable().lookup(decl.getName(), SymbolKind.CONST);
            output.add("const " + decl.getName() + ": " + symbol.getResolvedType().toDisplayString());
        } else if (decl instanceof AssertDecl) {
            output.add("断言通过");
        }
    }

    private void evaluateType(TypeRef type, String fileName, List<String> output) {
        ShapeAnalyzer analyzer = new ShapeAnalyzer(options);
        analyzer.analyze(program(declarations));
        LensType result = analyzer.evaluate(type);
        if (report(analyzer.getDiagnostics(), fileName, output)) return;
        output.add(result.toDisplayString());
    }

    /**
     * 输出诊断：本次输入的错误与警告，以及本次输入导致已有声明出现的错误（带位置）。
     * 已接受的声明集合始终没有错误，因此其他输入中的错误都由本次输入引起。
     *
     * @return 是否包含错误
     */
    private static boolean report(List<SemanticDiagnostic> diagnostics, String fileName, List<String> output) {
        boolean hasError = false;
        for (SemanticDiagnostic d : diagnostics) {
            boolean current = fileName.equals(d.getLocation().getFile());
            if (d.isError()) {
                hasError = true;
                output.add("错误: " + (current ? "" : d.getLocation() + ": ") + d.getMessage());
            } else if (current) {
                output.add("警告: " + d.getMessage());
            }
        }
        return hasError;
    }

    private static void removeSameName(List<Declaration> list, Declaration decl) {
        if (decl instanceof AssertDecl) return;
        Iterator<Declaration> it = list.iterator();
        while (it.hasNext()) {
            Declaration existing = it.next();
            if (existing.getClass() == decl.getClass() && existing.getName().equals(decl.getName())) {
                it.remove();
            }
        }
    }

    private static Program program(List<Declaration> decls) {
        return new Program(new SourceLocation("<repl>", 1, 1, 0, 0), new ArrayList<Declaration>(decls));
    }

    /** 已定义的类型别名，每个一行 */
    public List<String> describeTypes() {
        List<String> lines = new ArrayList<String>();
        AnalysisResult result = new ShapeAnalyzer(options).analyze(program(declarations));
        for (Declaration decl : declarations) {
            if (!(decl instanceof TypeAliasDecl)) continue;
            TypeAliasDecl alias = (TypeAliasDecl) decl;
            if (alias.isGeneric()) {
                lines.add("type " + alias.getName() + "<" + String.join(", ", alias.getTypeParams()) + ">");
            } else {
                lines.add("type " + alias.getName() + " = "
                        + result.getAliasType(alias.getName()).toDisplayString());
            }
        }
        return lines;
    }

    public void reset() {
        declarations.clear();
    }

    public int size() {
        return declarations.size();
    }
}
