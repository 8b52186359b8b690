package com.typelens.compiler.analysis.classify;

import com.typelens.compiler.analysis.types.LensType;
import com.typelens.compiler.analysis.types.LensTypes;
import com.typelens.compiler.analysis.types.ObjectLensType;
import com.typelens.compiler.analysis.types.TypeCompatibility;

/**
 * 成员存在性分类：可选 / 必需。
 *
 * <p>键 K 可选，当且仅当空对象 {@code {}} 可以赋给切片 {@code {K: S[K]}}。</p>
 */
public final class PresenceClassifier {

    private PresenceClassifier() {}

    public static boolean isOptional(ObjectLensType shape, String key) {
        return TypeCompatibility.isAssignable(shape.slice(key), LensTypes.EMPTY_OBJECT);
    }

    public static boolean isRequired(ObjectLensType shape, String key) {
        return !isOptional(shape, key);
    }

    public static boolean isOptional(LensType shape, String key) {
        return isOptional(LensTypes.requireShape(shape), key);
    }

    public static boolean isRequired(LensType shape, String key) {
        return !isOptional(LensTypes.requireShape(shape), key);
    }
}
