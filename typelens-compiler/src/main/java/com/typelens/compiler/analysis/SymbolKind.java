package com.typelens.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    TYPE_ALIAS,         // type 声明
    CONST               // const 声明
}
