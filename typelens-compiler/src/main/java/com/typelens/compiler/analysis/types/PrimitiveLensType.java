package com.typelens.compiler.analysis.types;

/**
 * 原始类型: number, string, boolean, bigint, symbol, null, undefined, void, object, Function
 */
public final class PrimitiveLensType extends LensType {

    private final String name;

    PrimitiveLensType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /** null / undefined / void 不接受任何属性访问 */
    public boolean isNullish() {
        return "null".equals(name) || "undefined".equals(name) || "void".equals(name);
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
        return visitor.visitPrimitive(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrimitiveLensType)) return false;
        return name.equals(((PrimitiveLensType) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
