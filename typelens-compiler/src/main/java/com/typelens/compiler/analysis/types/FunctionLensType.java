package com.typelens.compiler.analysis.types;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 函数类型: (a: number, b?: string) => void
 * 构造签名: new (...args: any[]) => T
 */
public final class FunctionLensType extends LensType {

    /**
     * 函数参数。
     */
    public static final class Param {
        private final String name;
        private final LensType type;
        private final boolean optional;
        private final boolean rest;

        public Param(String name, LensType type, boolean optional, boolean rest) {
            this.name = name;
            this.type = type;
            this.optional = optional;
            this.rest = rest;
        }

        public String getName() { return name; }
        public LensType getType() { return type; }
        public boolean isOptional() { return optional; }
        public boolean isRest() { return rest; }

        String toDisplayString() {
            return (rest ? "..." : "") + name + (optional ? "?" : "") + ": " + type.toDisplayString();
        }

        // 参数名不影响类型身份
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Param)) return false;
            Param that = (Param) o;
            return optional == that.optional && rest == that.rest && type.equals(that.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, optional, rest);
        }
    }

    private final List<Param> params;
    private final LensType returnType;
    private final boolean constructor;

    public FunctionLensType(List<Param> params, LensType returnType, boolean constructor) {
        this.params = Collections.unmodifiableList(params);
        this.returnType = returnType;
        this.constructor = constructor;
    }

    public List<Param> getParams() {
        return params;
    }

    public LensType getReturnType() {
        return returnType;
    }

    public boolean isConstructor() {
        return constructor;
    }

    public boolean hasRest() {
        return !params.isEmpty() && params.get(params.size() - 1).isRest();
    }

    /** 调用时必须提供的参数个数 */
    public int requiredParamCount() {
        int count = 0;
        for (Param p : params) {
            if (p.isOptional() || p.isRest()) break;
            count++;
        }
        return count;
    }

    String paramsDisplayString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(params.get(i).toDisplayString());
        }
        return sb.append(')').toString();
    }

    @Override
    public String getTypeName() {
        return null;
    }

    @Override
    public String toDisplayString() {
        return (constructor ? "new " : "") + paramsDisplayString() + " => " + returnType.toDisplayString();
    }

    @Override
    public <R> R accept(LensTypeVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionLensType)) return false;
        FunctionLensType that = (FunctionLensType) o;
        return constructor == that.constructor
                && params.equals(that.params)
                && returnType.equals(that.returnType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(params, returnType, constructor);
    }
}
