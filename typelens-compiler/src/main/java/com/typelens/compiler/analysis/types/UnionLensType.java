package com.typelens.compiler.analysis.types;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 联合类型: A | B | C
 *
 * <p>只能通过 {@link LensTypes#union} 构造，保证已展平、去重、至少两个成员。
 * 成员顺序不影响相等性。</p>
 */
public final class UnionLensType extends LensType {

    private final Set<LensType> alternatives;

    UnionLensType(Set<LensType> alternatives) {
        this.alternatives = Collections.unmodifiableSet(new LinkedHashSet<LensType>(alternatives));
    }

    public Set<LensType> getAlternatives() {
        return alternatives;
    }

    public boolean contains(LensType type) {
        return alternatives.contains(type);
    }

    @Override
    public String getTypeName() {
        return null;
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        for (LensType alt : alternatives) {
            if (sb.length() > 0) sb.append(" | ");
            String display = alt.toDisplayString();
            if (alt instanceof FunctionLensType) display = "(" + display + ")";
            sb.append(display);
        }
        return sb.toString();
    }

    @Override
    public <R> R accept(LensTypeVisitor<R> visitor) {
        return visitor.visitUnion(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnionLensType)) return false;
        return alternatives.equals(((UnionLensType) o).alternatives);
    }

    @Override
    public int hashCode() {
        return alternatives.hashCode();
    }
}
