package com.typelens.compiler.analysis.types;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 对象形状: { readonly a: number; b?: string; run(): void; [k: string]: T }
 *
 * <p>键名在同一形状内唯一；声明顺序只用于显示，不影响任何判断。</p>
 */
public final class ObjectLensType extends LensType {

    private final Map<String, MemberSignature> members;
    private final LensType indexType;   // 可选，字符串索引签名的值类型

    public ObjectLensType(List<MemberSignature> members, LensType indexType) {
        Map<String, MemberSignature> map = new LinkedHashMap<String, MemberSignature>();
        for (MemberSignature m : members) {
            if (map.containsKey(m.getName())) {
                throw new IllegalArgumentException("Duplicate member '" + m.getName() + "'");
            }
            map.put(m.getName(), m);
        }
        this.members = Collections.unmodifiableMap(map);
        this.indexType = indexType;
    }

    public ObjectLensType(List<MemberSignature> members) {
        this(members, null);
    }

    public Collection<MemberSignature> getMembers() {
        return members.values();
    }

    /** 按声明顺序返回所有键 */
    public List<String> keys() {
        return new ArrayList<String>(members.keySet());
    }

    public boolean hasMember(String key) {
        return members.containsKey(key);
    }

    /** 返回成员，不存在时返回 null */
    public MemberSignature getMember(String key) {
        return members.get(key);
    }

    /**
     * 返回成员，不存在时抛出 UNKNOWN_KEY。
     */
    public MemberSignature requireMember(String key) {
        MemberSignature member = members.get(key);
        if (member == null) throw TypeQueryException.unknownKey(this, key);
        return member;
    }

    public LensType getIndexType() {
        return indexType;
    }

    public boolean hasIndexSignature() {
        return indexType != null;
    }

    public boolean isEmpty() {
        return members.isEmpty() && indexType == null;
    }

    /**
     * 单成员切片 {K: S[K]}，保留该成员的全部修饰符。
     */
    public ObjectLensType slice(String key) {
        return new ObjectLensType(Collections.singletonList(requireMember(key)));
    }

    /**
     * 合成的全可变投影：所有成员去掉 readonly，值类型与可选性不变。
     */
    public ObjectLensType mutableProjection() {
        List<MemberSignature> projected = new ArrayList<MemberSignature>(members.size());
        for (MemberSignature m : members.values()) {
            projected.add(m.withReadonly(false));
        }
        return new ObjectLensType(projected, indexType);
    }

    @Override
    public String getTypeName() {
        return null;
    }

    @Override
    public String toDisplayString() {
        if (isEmpty()) return "{}";
        StringBuilder sb = new StringBuilder("{ ");
        boolean first = true;
        for (MemberSignature m : members.values()) {
            if (!first) sb.append("; ");
            sb.append(m.toDisplayString());
            first = false;
        }
        if (indexType != null) {
            if (!first) sb.append("; ");
            sb.append("[key: string]: ").append(indexType.toDisplayString());
        }
        sb.append(" }");
        return sb.toString();
    }

    /** 非标识符键以字符串字面量形式显示 */
    static String displayKey(String key) {
        if (key.isEmpty()) return "\"\"";
        if (!Character.isJavaIdentifierStart(key.charAt(0))) return '"' + key + '"';
        for (int i = 1; i < key.length(); i++) {
            if (!Character.isJavaIdentifierPart(key.charAt(i))) return '"' + key + '"';
        }
        return key;
    }

    @Override
    public <R> R accept(LensTypeVisitor<R> visitor) {
        return visitor.visitObject(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectLensType)) return false;
        ObjectLensType that = (ObjectLensType) o;
        return members.equals(that.members) && Objects.equals(indexType, that.indexType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(members, indexType);
    }
}
