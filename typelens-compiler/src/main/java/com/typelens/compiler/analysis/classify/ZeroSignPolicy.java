package com.typelens.compiler.analysis.classify;

/**
 * 字面量 0 的符号归类。
 *
 * <p>0 的规范文本既没有 "-" 也没有 "."，两个独立的文本测试会把它判为正整数；
 * 需要数学意义上的"严格为正"时选择 {@link #UNSIGNED}。</p>
 */
public enum ZeroSignPolicy {
    /** 0 视为正数（也就是正整数），与文本测试的结果一致 */
    POSITIVE,
    /** 0 既不是正数也不是负数 */
    UNSIGNED;

    /** 按名称解析（大小写不敏感），未知名称返回 null */
    public static ZeroSignPolicy fromName(String name) {
        if (name == null) return null;
        for (ZeroSignPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(name.trim())) return policy;
        }
        return null;
    }
}
