package com.typelens.compiler.analysis.types;

/**
 * never 类型 — 所有类型的子类型，空联合。
 */
public final class NeverType extends LensType {

    public static final NeverType INSTANCE = new NeverType();

    private NeverType() {
    }

    @Override
    public String getTypeName() {
        return "never";
    }

    @Override
    public String toDisplayString() {
        return "never";
    }

    @Override
    public <R> R accept(LensTypeVisitor<R> visitor) {
        return visitor.visitNever(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NeverType;
    }

    @Override
    public int hashCode() {
        return 0;
    }
}
