package com.typelens.compiler.analysis.classify;

import com.typelens.compiler.analysis.types.LensType;
import com.typelens.compiler.analysis.types.LensTypes;
import com.typelens.compiler.analysis.types.LiteralLensType;
import com.typelens.compiler.analysis.types.TypeQueryException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 键名集合。无序语义（equals 与顺序无关），迭代按插入顺序。
 */
public final class KeySet implements Iterable<String> {

    public static final KeySet EMPTY = new KeySet(Collections.<String>emptyList());

    private final Set<String> keys;

    public KeySet(Collection<String> keys) {
        this.keys = Collections.unmodifiableSet(new LinkedHashSet<String>(keys));
    }

    public static KeySet of(String... keys) {
        List<String> list = new ArrayList<String>();
        Collections.addAll(list, keys);
        return new KeySet(list);
    }

    /**
     * 由字符串字面量（或其联合）构造键集合；never 为空集合。
     */
    public static KeySet fromType(LensType type) {
        List<String> names = new ArrayList<String>();
        for (LensType alt : LensTypes.alternativesOf(type)) {
            if (!(alt instanceof LiteralLensType) || !((LiteralLensType) alt).isString()) {
                throw new TypeQueryException(TypeQueryException.Kind.NOT_A_KEY_SET,
                        "类型 '" + type.toDisplayString() + "' 不是字符串字面量键集合");
            }
            names.add(((LiteralLensType) alt).getText());
        }
        return new KeySet(names);
    }

    /** 转为字符串字面量联合，空集合为 never */
    public LensType toType() {
        List<LensType> literals = new ArrayList<LensType>(keys.size());
        for (String key : keys) {
            literals.add(LensTypes.stringLiteral(key));
        }
        return LensTypes.union(literals);
    }

    public boolean contains(String key) {
        return keys.contains(key);
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public Set<String> asSet() {
        return keys;
    }

    public KeySet union(KeySet other) {
        Set<String> merged = new LinkedHashSet<String>(keys);
        merged.addAll(other.keys);
        return new KeySet(merged);
    }

    public KeySet intersect(KeySet other) {
        Set<String> common = new LinkedHashSet<String>(keys);
        common.retainAll(other.keys);
        return new KeySet(common);
    }

    @Override
    public Iterator<String> iterator() {
        return keys.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeySet)) return false;
        return keys.equals(((KeySet) o).keys);
    }

    @Override
    public int hashCode() {
        return keys.hashCode();
    }

    @Override
    public String toString() {
        return keys.toString();
    }
}
