package com.typelens.compiler.analysis.types;

import java.util.Objects;

/**
 * 对象形状中的一个成员：名称、声明类型、只读标记、可选标记。
 *
 * <p>{@code method} 仅影响显示（{@code run(): void} 与 {@code run: () => void}），
 * 不参与相等性判断。</p>
 */
public final class MemberSignature {

    private final String name;
    private final LensType type;
    private final boolean readonly;
    private final boolean optional;
    private final boolean method;

    // 读取类型：可选成员隐含 | undefined
    private final LensType readType;

    public MemberSignature(String name, LensType type, boolean readonly, boolean optional, boolean method) {
        this.name = name;
        this.type = type;
        this.readonly = readonly;
        this.optional = optional;
        this.method = method && type instanceof FunctionLensType;
        this.readType = optional ? LensTypes.union(type, LensTypes.UNDEFINED) : type;
    }

    public static MemberSignature property(String name, LensType type) {
        return new MemberSignature(name, type, false, false, false);
    }

    public String getName() {
        return name;
    }

    /** 声明类型（不含可选隐含的 undefined） */
    public LensType getType() {
        return type;
    }

    /** 通过属性访问读到的类型 */
    public LensType getReadType() {
        return readType;
    }

    public boolean isReadonly() {
        return readonly;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isMethod() {
        return method;
    }

    public MemberSignature withReadonly(boolean readonly) {
        if (this.readonly == readonly) return this;
        return new MemberSignature(name, type, readonly, optional, method);
    }

    public MemberSignature withOptional(boolean optional) {
        if (this.optional == optional) return this;
        return new MemberSignature(name, type, readonly, optional, method);
    }

    public MemberSignature withType(LensType type) {
        return new MemberSignature(name, type, readonly, optional, method);
    }

    public String toDisplayString() {
        StringBuilder sb = new StringBuilder();
        if (readonly) sb.append("readonly ");
        sb.append(ObjectLensType.displayKey(name));
        if (optional) sb.append('?');
        if (method) {
            FunctionLensType fn = (FunctionLensType) type;
            sb.append(fn.paramsDisplayString()).append(": ").append(fn.getReturnType().toDisplayString());
        } else {
            sb.append(": ").append(type.toDisplayString());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemberSignature)) return false;
        MemberSignature that = (MemberSignature) o;
        return readonly == that.readonly && optional == that.optional
                && name.equals(that.name) && readType.equals(that.readType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, readType, readonly, optional);
    }
}
