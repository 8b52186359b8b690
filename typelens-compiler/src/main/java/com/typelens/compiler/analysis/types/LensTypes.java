package com.typelens.compiler.analysis.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 预定义类型常量和工厂方法。
 */
public final class LensTypes {

    private LensTypes() {}

    // 原始类型
    public static final PrimitiveLensType NUMBER = new PrimitiveLensType("number");
    public static final PrimitiveLensType STRING = new PrimitiveLensType("string");
    public static final PrimitiveLensType BOOLEAN = new PrimitiveLensType("boolean");
    public static final PrimitiveLensType BIGINT = new PrimitiveLensType("bigint");
    public static final PrimitiveLensType SYMBOL = new PrimitiveLensType("symbol");
    public static final PrimitiveLensType NULL = new PrimitiveLensType("null");
    public static final PrimitiveLensType UNDEFINED = new PrimitiveLensType("undefined");
    public static final PrimitiveLensType VOID = new PrimitiveLensType("void");
    public static final PrimitiveLensType OBJECT = new PrimitiveLensType("object");

    /** 可调用类别：接受所有函数与构造签名 */
    public static final PrimitiveLensType FUNCTION = new PrimitiveLensType("Function");

    // 特殊类型
    public static final AnyType ANY = AnyType.ANY;
    public static final AnyType UNKNOWN = AnyType.UNKNOWN;
    public static final NeverType NEVER = NeverType.INSTANCE;
    public static final ErrorType ERROR = ErrorType.INSTANCE;

    public static final LiteralLensType TRUE = new LiteralLensType(LiteralLensType.Kind.BOOLEAN, "true");
    public static final LiteralLensType FALSE = new LiteralLensType(LiteralLensType.Kind.BOOLEAN, "false");

    /** 空对象类型 {} */
    public static final ObjectLensType EMPTY_OBJECT =
            new ObjectLensType(Collections.<MemberSignature>emptyList());

    /** 根据类型名查找内置类型 */
    public static LensType fromName(String name) {
        switch (name) {
            case "number": return NUMBER;
            case "string": return STRING;
            case "boolean": return BOOLEAN;
            case "bigint": return BIGINT;
            case "symbol": return SYMBOL;
            case "null": return NULL;
            case "undefined": return UNDEFINED;
            case "void": return VOID;
            case "object": return OBJECT;
            case "Function": return FUNCTION;
            case "any": return ANY;
            case "unknown": return UNKNOWN;
            case "never": return NEVER;
            default: return null;
        }
    }

    // ============ 字面量 ============

    /** 由源码拼写创建数值字面量类型（自动规范化） */
    public static LiteralLensType numberLiteral(String spelling) {
        return new LiteralLensType(LiteralLensType.Kind.NUMBER, NumericLiterals.canonicalize(spelling));
    }

    public static LiteralLensType stringLiteral(String value) {
        return new LiteralLensType(LiteralLensType.Kind.STRING, value);
    }

    public static LiteralLensType booleanLiteral(boolean value) {
        return value ? TRUE : FALSE;
    }

    // ============ 复合类型 ============

    public static ObjectLensType object(MemberSignature... members) {
        return new ObjectLensType(Arrays.asList(members));
    }

    public static ArrayLensType arrayOf(LensType element) {
        return new ArrayLensType(element, false);
    }

    public static ArrayLensType readonlyArrayOf(LensType element) {
        return new ArrayLensType(element, true);
    }

    /** 创建无参函数类型 () => ret */
    public static FunctionLensType function(LensType returnType) {
        return new FunctionLensType(Collections.<FunctionLensType.Param>emptyList(), returnType, false);
    }

    /** 构造签名 new (...args: any[]) => instance */
    public static FunctionLensType constructorOf(LensType instanceType) {
        FunctionLensType.Param rest = new FunctionLensType.Param("args", arrayOf(ANY), false, true);
        return new FunctionLensType(Collections.singletonList(rest), instanceType, true);
    }

    public static LensType union(LensType... types) {
        return union(Arrays.asList(types));
    }

    /**
     * 构造规范化的联合类型：
     * 展平嵌套联合、去掉 never、any/unknown 吸收其余成员、
     * true | false 合并为 boolean、被原始类型覆盖的字面量被吸收、去重。
     * 空联合返回 never，单成员返回该成员本身。
     */
    public static LensType union(List<LensType> types) {
        Set<LensType> flat = new LinkedHashSet<LensType>();
        for (LensType t : types) {
            if (t instanceof ErrorType) return ERROR;
            if (t instanceof UnionLensType) {
                flat.addAll(((UnionLensType) t).getAlternatives());
            } else if (!(t instanceof NeverType)) {
                flat.add(t);
            }
        }
        if (flat.contains(ANY)) return ANY;
        if (flat.contains(UNKNOWN)) return UNKNOWN;

        if (flat.contains(TRUE) && flat.contains(FALSE)) {
            List<LensType> merged = new ArrayList<LensType>(flat.size());
            for (LensType t : flat) {
                if (t.equals(TRUE)) merged.add(BOOLEAN);
                else if (!t.equals(FALSE)) merged.add(t);
            }
            flat = new LinkedHashSet<LensType>(merged);
        }

        Set<LensType> reduced = new LinkedHashSet<LensType>();
        for (LensType t : flat) {
            if (t instanceof LiteralLensType && flat.contains(((LiteralLensType) t).widen())) continue;
            reduced.add(t);
        }

        if (reduced.isEmpty()) return NEVER;
        if (reduced.size() == 1) return reduced.iterator().next();
        return new UnionLensType(reduced);
    }

    /** 联合类型的成员；非联合类型返回自身，never 返回空列表 */
    public static List<LensType> alternativesOf(LensType type) {
        if (type instanceof UnionLensType) {
            return new ArrayList<LensType>(((UnionLensType) type).getAlternatives());
        }
        if (type instanceof NeverType) return Collections.emptyList();
        return Collections.singletonList(type);
    }

    /** 去掉联合中的 undefined（NonIndefinable） */
    public static LensType stripUndefined(LensType type) {
        List<LensType> kept = new ArrayList<LensType>();
        for (LensType alt : alternativesOf(type)) {
            if (!UNDEFINED.equals(alt)) kept.add(alt);
        }
        return union(kept);
    }

    /** 去掉联合中的 null 与 undefined */
    public static LensType stripNullish(LensType type) {
        List<LensType> kept = new ArrayList<LensType>();
        for (LensType alt : alternativesOf(type)) {
            if (!UNDEFINED.equals(alt) && !NULL.equals(alt)) kept.add(alt);
        }
        return union(kept);
    }

    /**
     * 要求类型是对象形状，否则抛出 NOT_AN_OBJECT_SHAPE。
     */
    public static ObjectLensType requireShape(LensType type) {
        if (type instanceof ObjectLensType) return (ObjectLensType) type;
        throw new TypeQueryException(TypeQueryException.Kind.NOT_AN_OBJECT_SHAPE,
                "类型 '" + type.toDisplayString() + "' 不是对象形状");
    }

    /** Falsy: "" | 0 | false | null | undefined */
    public static LensType falsy() {
        return union(stringLiteral(""), numberLiteral("0"), FALSE, NULL, UNDEFINED);
    }

    /** Primitive: bigint | boolean | null | number | string | symbol | undefined */
    public static LensType primitive() {
        return union(BIGINT, BOOLEAN, NULL, NUMBER, STRING, SYMBOL, UNDEFINED);
    }
}
