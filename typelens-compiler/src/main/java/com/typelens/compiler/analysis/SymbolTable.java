package com.typelens.compiler.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 符号表：类型与常量分属两个命名空间
 */
public final class SymbolTable {
    private final Map<String, Symbol> types = new LinkedHashMap<String, Symbol>();
    private final Map<String, Symbol> consts = new LinkedHashMap<String, Symbol>();

    /**
     * 定义符号
     *
     * @return 同名的已有符号；定义成功返回 null
     */
    public Symbol define(Symbol symbol) {
        Map<String, Symbol> space = spaceOf(symbol.getKind());
        Symbol existing = space.get(symbol.getName());
        if (existing != null) return existing;
        space.put(symbol.getName(), symbol);
        return null;
    }

    public Symbol lookup(String name, SymbolKind kind) {
        return spaceOf(kind).get(name);
    }

    /** 获取所有指定类型的符号（按声明顺序） */
    public List<Symbol> getAllSymbolsOfKind(SymbolKind... kinds) {
        List<Symbol> result = new ArrayList<Symbol>();
        for (SymbolKind kind : kinds) {
            result.addAll(spaceOf(kind).values());
        }
        return result;
    }

    private Map<String, Symbol> spaceOf(SymbolKind kind) {
        return kind == SymbolKind.TYPE_ALIAS ? types : consts;
    }
}
