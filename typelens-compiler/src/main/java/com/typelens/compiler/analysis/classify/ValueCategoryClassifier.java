package com.typelens.compiler.analysis.classify;

import com.typelens.compiler.analysis.types.AnyType;
import com.typelens.compiler.analysis.types.LensType;
import com.typelens.compiler.analysis.types.LensTypes;
import com.typelens.compiler.analysis.types.NeverType;
import com.typelens.compiler.analysis.types.ObjectLensType;
import com.typelens.compiler.analysis.types.TypeCompatibility;

/**
 * 成员值类别分类：函数 / 非函数，以及任意目标类别匹配。
 */
public final class ValueCategoryClassifier {

    private ValueCategoryClassifier() {}

    /**
     * 成员的类型（去掉 undefined 后）是否可调用。
     * 可选的函数成员仍然是函数成员；声明为 undefined 或 any 的成员不是。
     */
    public static boolean isFunctionValued(ObjectLensType shape, String key) {
        LensType stripped = LensTypes.stripUndefined(shape.requireMember(key).getReadType());
        if (stripped instanceof NeverType || stripped instanceof AnyType) return false;
        return TypeCompatibility.isAssignable(LensTypes.FUNCTION, stripped);
    }

    public static boolean isNonFunctionValued(ObjectLensType shape, String key) {
        return !isFunctionValued(shape, key);
    }

    /**
     * 成员的读取类型（可选成员含 undefined）是否可以赋给目标类别。
     */
    public static boolean matchesCategory(ObjectLensType shape, String key, LensType category) {
        return TypeCompatibility.isAssignable(category, shape.requireMember(key).getReadType());
    }

    public static boolean isFunctionValued(LensType shape, String key) {
        return isFunctionValued(LensTypes.requireShape(shape), key);
    }

    public static boolean matchesCategory(LensType shape, String key, LensType category) {
        return matchesCategory(LensTypes.requireShape(shape), key, category);
    }
}
