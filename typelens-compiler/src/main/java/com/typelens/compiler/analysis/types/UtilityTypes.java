package com.typelens.compiler.analysis.types;

import com.typelens.compiler.analysis.classify.KeySet;
import com.typelens.compiler.analysis.classify.KeySetExtractor;
import com.typelens.compiler.analysis.classify.MutabilityClassifier;
import com.typelens.compiler.analysis.classify.NumericLiteralClassifier;
import com.typelens.compiler.analysis.classify.PresenceClassifier;
import com.typelens.compiler.analysis.classify.ShapeTransforms;
import com.typelens.compiler.analysis.classify.ValueCategoryClassifier;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 按名称调用的内置工具类型。
 *
 * <p>参数均已解析为 {@link LensType}；非法参数抛出 {@link TypeQueryException}。</p>
 */
public final class UtilityTypes {

    private static final Set<String> NAMES = Collections.unmodifiableSet(new LinkedHashSet<String>(Arrays.asList(
            // 键集合
            "ReadonlyKeys", "NonReadonly", "WritableKeys", "OptionalKey", "OptionalKeys",
            "RequiredKey", "RequiredKeys", "FuncKey", "FunctionKeys", "NonFuncKey", "NonFunctionKeys",
            "KeysWithValueType", "ObjectKey",
            // 形状
            "PickRequired", "Mutable", "Readonly", "Partial", "Required", "Pick", "Omit", "Optional",
            "PlainObject",
            // 谓词
            "Equal", "IsReadonly", "IsWritable", "IsOptional", "IsRequired", "IsFunction", "IsValueType",
            "IsInteger", "IsPositive", "IsNegative", "IsPositiveInteger", "IsNegativeInteger",
            // 数值收窄
            "Integer", "PositiveInteger", "NegativeInteger",
            // 别名与访问器
            "Nullable", "Nullish", "NonIndefinable", "PropertyType", "ArrayItem",
            "ConstructorType", "InstantiableClass", "Falsy", "Primitive")));

    private final NumericLiteralClassifier numeric;

    public UtilityTypes(NumericLiteralClassifier numeric) {
        this.numeric = numeric;
    }

    public static boolean isUtility(String name) {
        return NAMES.contains(name);
    }

    public static Set<String> names() {
        return NAMES;
    }

    /** 最少类型参数个数 */
    public static int minArity(String name) {
        switch (name) {
            case "Falsy":
            case "Primitive":
            case "ConstructorType":
            case "InstantiableClass":
                return 0;
            default:
                return maxArity(name);
        }
    }

    /** 最多类型参数个数 */
    public static int maxArity(String name) {
        switch (name) {
            case "Falsy":
            case "Primitive":
                return 0;
            case "KeysWithValueType":
            case "Pick":
            case "Omit":
            case "Optional":
            case "Equal":
            case "IsReadonly":
            case "IsWritable":
            case "IsOptional":
            case "IsRequired":
            case "IsFunction":
            case "PropertyType":
                return 2;
            case "IsValueType":
                return 3;
            default:
                return 1;
        }
    }

    /**
     * 应用工具类型
     *
     * @param name 工具类型名，须满足 {@link #isUtility(String)}
     * @param args 已解析的参数，个数须在 [minArity, maxArity] 之间
     */
    public LensType apply(String name, List<LensType> args) {
        switch (name) {
            // ---- 键集合 ----
            case "ReadonlyKeys":
                return KeySetExtractor.readonlyKeys(shape(args, 0)).toType();
            case "NonReadonly":
            case "WritableKeys":
                return KeySetExtractor.writableKeys(shape(args, 0)).toType();
            case "OptionalKey":
            case "OptionalKeys":
                return KeySetExtractor.optionalKeys(shape(args, 0)).toType();
            case "RequiredKey":
            case "RequiredKeys":
                return KeySetExtractor.requiredKeys(shape(args, 0)).toType();
            case "FuncKey":
            case "FunctionKeys":
                return KeySetExtractor.functionKeys(shape(args, 0)).toType();
            case "NonFuncKey":
            case "NonFunctionKeys":
                return KeySetExtractor.nonFunctionKeys(shape(args, 0)).toType();
            case "KeysWithValueType":
                return keysWithValueType(shape(args, 0), args.get(1));
            case "ObjectKey":
                return KeySetExtractor.allKeys(shape(args, 0)).toType();

            // ---- 形状 ----
            case "PickRequired":
                return KeySetExtractor.pickRequired(shape(args, 0));
            case "Mutable":
                return ShapeTransforms.mutable(shape(args, 0));
            case "Readonly":
                return readonly(args.get(0));
            case "Partial":
                return ShapeTransforms.partial(shape(args, 0));
            case "Required":
                return ShapeTransforms.required(shape(args, 0));
            case "Pick":
                return ShapeTransforms.pick(shape(args, 0), KeySet.fromType(args.get(1)));
            case "Omit":
                return ShapeTransforms.omit(shape(args, 0), KeySet.fromType(args.get(1)));
            case "Optional":
                return ShapeTransforms.optional(shape(args, 0), KeySet.fromType(args.get(1)));
            case "PlainObject":
                return new ObjectLensType(Collections.<MemberSignature>emptyList(), args.get(0));

            // ---- 谓词 ----
            case "Equal":
                return LensTypes.booleanLiteral(TypeEquality.isIdentical(args.get(0), args.get(1)));
            case "IsReadonly":
                return LensTypes.booleanLiteral(MutabilityClassifier.isReadonly(shape(args, 0), key(args, 1)));
            case "IsWritable":
                return LensTypes.booleanLiteral(MutabilityClassifier.isWritable(shape(args, 0), key(args, 1)));
            case "IsOptional":
                return LensTypes.booleanLiteral(PresenceClassifier.isOptional(shape(args, 0), key(args, 1)));
            case "IsRequired":
                return LensTypes.booleanLiteral(PresenceClassifier.isRequired(shape(args, 0), key(args, 1)));
            case "IsFunction":
                return LensTypes.booleanLiteral(
                        ValueCategoryClassifier.isFunctionValued(shape(args, 0), key(args, 1)));
            case "IsValueType":
                return LensTypes.booleanLiteral(
                        ValueCategoryClassifier.matchesCategory(shape(args, 0), key(args, 1), args.get(2)));
            case "IsInteger":
                return LensTypes.booleanLiteral(numeric.isInteger(args.get(0)));
            case "IsPositive":
                return LensTypes.booleanLiteral(numeric.isPositive(args.get(0)));
            case "IsNegative":
                return LensTypes.booleanLiteral(numeric.isNegative(args.get(0)));
            case "IsPositiveInteger":
                return LensTypes.booleanLiteral(numeric.isPositiveInteger(args.get(0)));
            case "IsNegativeInteger":
                return LensTypes.booleanLiteral(numeric.isNegativeInteger(args.get(0)));

            // ---- 数值收窄 ----
            case "Integer":
                return numeric.narrowInteger(args.get(0));
            case "PositiveInteger":
                return numeric.narrowPositiveInteger(args.get(0));
            case "NegativeInteger":
                return numeric.narrowNegativeInteger(args.get(0));

            // ---- 别名与访问器 ----
            case "Nullable":
                return LensTypes.union(args.get(0), LensTypes.NULL);
            case "Nullish":
                return LensTypes.union(args.get(0), LensTypes.NULL, LensTypes.UNDEFINED);
            case "NonIndefinable":
                return LensTypes.stripUndefined(args.get(0));
            case "PropertyType":
                return propertyType(shape(args, 0), KeySet.fromType(args.get(1)));
            case "ArrayItem":
                return arrayItem(args.get(0));
            case "ConstructorType":
            case "InstantiableClass":
                return LensTypes.constructorOf(args.isEmpty() ? LensTypes.ANY : args.get(0));
            case "Falsy":
                return LensTypes.falsy();
            case "Primitive":
                return LensTypes.primitive();
            default:
                throw new IllegalArgumentException("Unknown utility type: " + name);
        }
    }

    /**
     * 非空形状上没有任何成员匹配值类别时视为类别与形状不兼容。
     */
    private static LensType keysWithValueType(ObjectLensType shape, LensType category) {
        KeySet keys = KeySetExtractor.keysWithValueType(shape, category);
        if (keys.isEmpty() && !shape.isEmpty()) {
            throw new TypeQueryException(TypeQueryException.Kind.INCOMPATIBLE_CATEGORY,
                    "类型 '" + shape.toDisplayString() + "' 中没有值类型可赋给 '"
                            + category.toDisplayString() + "' 的成员");
        }
        return keys.toType();
    }

    /** Readonly 同时接受对象形状与数组 */
    private static LensType readonly(LensType type) {
        if (type instanceof ArrayLensType) {
            return LensTypes.readonlyArrayOf(((ArrayLensType) type).getElementType());
        }
        return ShapeTransforms.readonly(LensTypes.requireShape(type));
    }

    static LensType propertyType(ObjectLensType shape, KeySet keys) {
        LensType[] parts = new LensType[keys.size()];
        int i = 0;
        for (String key : keys) {
            parts[i++] = shape.requireMember(key).getReadType();
        }
        return LensTypes.union(parts);
    }

    private static LensType arrayItem(LensType type) {
        if (type instanceof ArrayLensType) {
            return ((ArrayLensType) type).getElementType();
        }
        throw new TypeQueryException(TypeQueryException.Kind.BAD_ARGUMENT,
                "ArrayItem 需要数组类型，实际为 '" + type.toDisplayString() + "'");
    }

    private static ObjectLensType shape(List<LensType> args, int index) {
        return LensTypes.requireShape(args.get(index));
    }

    /** 单个键名参数 */
    private static String key(List<LensType> args, int index) {
        KeySet keys = KeySet.fromType(args.get(index));
        if (keys.size() != 1) {
            throw new TypeQueryException(TypeQueryException.Kind.NOT_A_KEY_SET,
                    "需要单个键名，实际为 '" + args.get(index).toDisplayString() + "'");
        }
        return keys.iterator().next();
    }
}
