package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.types.LensType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 语义分析结果
 */
public final class AnalysisResult {
    private final SymbolTable symbolTable;
    private final List<SemanticDiagnostic> diagnostics;
    private final Map<String, LensType> evaluatedAliases;

    public AnalysisResult(SymbolTable symbolTable, List<SemanticDiagnostic> diagnostics,
                          Map<String, LensType> evaluatedAliases) {
        this.symbolTable = symbolTable;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
        this.evaluatedAliases = Collections.unmodifiableMap(evaluatedAliases);
    }

    public SymbolTable getSymbolTable() { return symbolTable; }
    public List<SemanticDiagnostic> getDiagnostics() { return diagnostics; }

    /** 非泛型别名的求值结果（按声明顺序） */
    public Map<String, LensType> getEvaluatedAliases() { return evaluatedAliases; }

    public LensType getAliasType(String name) {
        return evaluatedAliases.get(name);
    }

    public boolean hasErrors() {
        for (SemanticDiagnostic d : diagnostics) {
            if (d.isError()) return true;
        }
        return false;
    }

    public List<SemanticDiagnostic> getDiagnostics(SemanticDiagnostic.Severity severity) {
        List<SemanticDiagnostic> result = new ArrayList<SemanticDiagnostic>();
        for (SemanticDiagnostic d : diagnostics) {
            if (d.getSeverity() == severity) result.add(d);
        }
        return result;
    }
}
