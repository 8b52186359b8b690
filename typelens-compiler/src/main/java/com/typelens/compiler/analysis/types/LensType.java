package com.typelens.compiler.analysis.types;

/**
 * 结构化类型表示基类。
 * 所有子类均为不可变值对象，equals/hashCode 按结构比较。
 */
public abstract class LensType {

    protected LensType() {
    }

    /**
     * 返回内置类型名（如 "number", "string", "any"）。
     * 字面量、对象、函数、数组、联合类型返回 null。
     */
    public abstract String getTypeName();

    /** 人类可读的类型名，用于诊断消息 */
    public abstract String toDisplayString();

    /** 接受 LensTypeVisitor 进行类型分派 */
    public abstract <R> R accept(LensTypeVisitor<R> visitor);

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
