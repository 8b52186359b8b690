package com.typelens.compiler.analysis.types;

import java.util.Objects;

/**
 * 数组类型: T[], readonly T[]
 */
public final class ArrayLensType extends LensType {

    private final LensType elementType;
    private final boolean readonly;

    public ArrayLensType(LensType elementType, boolean readonly) {
        this.elementType = elementType;
        this.readonly = readonly;
    }

    public LensType getElementType() {
        return elementType;
    }

    public boolean isReadonly() {
        return readonly;
    }

    @Override
    public String getTypeName() {
        return null;
    }

    @Override
    public String toDisplayString() {
        String elem = elementType.toDisplayString();
        if (elementType instanceof UnionLensType || elementType instanceof FunctionLensType) {
            elem = "(" + elem + ")";
        }
        return (readonly ? "readonly " : "") + elem + "[]";
    }

    @Override
    public <R> R accept(LensTypeVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayLensType)) return false;
        ArrayLensType that = (ArrayLensType) o;
        return readonly == that.readonly && elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementType, readonly);
    }
}
