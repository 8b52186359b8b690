package com.typelens.compiler.analysis.types;

/**
 * 顶类型: any 与 unknown。
 * 两者都接受所有类型；any 还可以赋给任何类型（never 除外），unknown 不行。
 */
public final class AnyType extends LensType {

    public static final AnyType ANY = new AnyType("any");
    public static final AnyType UNKNOWN = new AnyType("unknown");

    private final String name;

    private AnyType(String name) {
        this.name = name;
    }

    public boolean isUnknown() {
        return this == UNKNOWN;
    }

    @Override
    public String getTypeName() {
        return name;
    }

    @Override
    public String toDisplayString() {
        return name;
    }

    @Override
    public <R> R accept(LensTypeVisitor<R> visitor) {
        return visitor.visitAny(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
