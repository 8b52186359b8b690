package com.typelens.compiler.analysis.classify;

import com.typelens.compiler.analysis.types.LensTypes;
import com.typelens.compiler.analysis.types.MemberSignature;
import com.typelens.compiler.analysis.types.ObjectLensType;
import com.typelens.compiler.analysis.types.TypeCompatibility;

import java.util.ArrayList;
import java.util.List;

/**
 * 形状变换：Mutable、Readonly、Partial、Required、Pick、Omit、Optional。
 * 所有变换都保留成员的声明顺序，返回新的形状。
 */
public final class ShapeTransforms {

    private ShapeTransforms() {}

    /** 去掉所有成员的 readonly */
    public static ObjectLensType mutable(ObjectLensType shape) {
        return shape.mutableProjection();
    }

    /** 所有成员加上 readonly */
    public static ObjectLensType readonly(ObjectLensType shape) {
        List<MemberSignature> members = new ArrayList<MemberSignature>();
        for (MemberSignature m : shape.getMembers()) {
            members.add(m.withReadonly(true));
        }
        return new ObjectLensType(members, shape.getIndexType());
    }

    /** 所有成员变为可选 */
    public static ObjectLensType partial(ObjectLensType shape) {
        List<MemberSignature> members = new ArrayList<MemberSignature>();
        for (MemberSignature m : shape.getMembers()) {
            members.add(m.withOptional(true));
        }
        return new ObjectLensType(members, shape.getIndexType());
    }

    /** 所有成员变为必需，可选带来的 undefined 一并去掉 */
    public static ObjectLensType required(ObjectLensType shape) {
        List<MemberSignature> members = new ArrayList<MemberSignature>();
        for (MemberSignature m : shape.getMembers()) {
            if (m.isOptional()) {
                members.add(m.withOptional(false).withType(LensTypes.stripUndefined(m.getType())));
            } else {
                members.add(m);
            }
        }
        return new ObjectLensType(members, shape.getIndexType());
    }

    /** 只保留给定键；键必须存在 */
    public static ObjectLensType pick(ObjectLensType shape, KeySet keys) {
        for (String key : keys) {
            shape.requireMember(key);
        }
        List<MemberSignature> members = new ArrayList<MemberSignature>();
        for (MemberSignature m : shape.getMembers()) {
            if (keys.contains(m.getName())) members.add(m);
        }
        return new ObjectLensType(members);
    }

    /** 去掉给定键；不存在的键被忽略 */
    public static ObjectLensType omit(ObjectLensType shape, KeySet keys) {
        List<MemberSignature> members = new ArrayList<MemberSignature>();
        for (MemberSignature m : shape.getMembers()) {
            if (!keys.contains(m.getName())) members.add(m);
        }
        return new ObjectLensType(members, shape.getIndexType());
    }

    /**
     * 将给定键变为可选，其余成员不变（Omit&lt;T, K&gt; &amp; Partial&lt;Pick&lt;T, K&gt;&gt; 的展平形式）。
     */
    public static ObjectLensType optional(ObjectLensType shape, KeySet keys) {
        for (String key : keys) {
            shape.requireMember(key);
        }
        List<MemberSignature> members = new ArrayList<MemberSignature>();
        for (MemberSignature m : shape.getMembers()) {
            members.add(keys.contains(m.getName()) ? m.withOptional(true) : m);
        }
        return new ObjectLensType(members, shape.getIndexType());
    }

    /**
     * 合并两个形状 (A &amp; B)。同名成员的类型取两者都满足的一侧：
     * 一侧可赋给另一侧时取更窄者，readonly 取或、可选取与。
     *
     * @return 合并后的形状；同名成员无法合并时返回 null
     */
    public static ObjectLensType intersect(ObjectLensType left, ObjectLensType right) {
        List<MemberSignature> members = new ArrayList<MemberSignature>();
        for (MemberSignature l : left.getMembers()) {
            MemberSignature r = right.getMember(l.getName());
            if (r == null) {
                members.add(l);
                continue;
            }
            MemberSignature narrower;
            if (TypeCompatibility.isAssignable(r.getType(), l.getType())) {
                narrower = l;
            } else if (TypeCompatibility.isAssignable(l.getType(), r.getType())) {
                narrower = r;
            } else {
                return null;
            }
            members.add(new MemberSignature(l.getName(), narrower.getType(),
                    l.isReadonly() || r.isReadonly(), l.isOptional() && r.isOptional(), narrower.isMethod()));
        }
        for (MemberSignature r : right.getMembers()) {
            if (!left.hasMember(r.getName())) members.add(r);
        }
        if (left.hasIndexSignature() && right.hasIndexSignature()
                && !left.getIndexType().equals(right.getIndexType())) {
            return null;
        }
        return new ObjectLensType(members, left.hasIndexSignature() ? left.getIndexType() : right.getIndexType());
    }
}
