package com.typelens.compiler.analysis.classify;

import com.typelens.compiler.analysis.types.LensType;
import com.typelens.compiler.analysis.types.LensTypes;
import com.typelens.compiler.analysis.types.ObjectLensType;
import com.typelens.compiler.analysis.types.TypeEquality;

/**
 * 成员可变性分类：只读 / 可写。
 *
 * <p>键 K 可写，当且仅当 {@code {K: S[K]}} 与全可变投影中的同一切片完全相同。
 * readonly 不影响可赋值性，所以这里必须使用 {@link TypeEquality} 而不是双向可赋值。</p>
 */
public final class MutabilityClassifier {

    private MutabilityClassifier() {}

    public static boolean isWritable(ObjectLensType shape, String key) {
        ObjectLensType slice = shape.slice(key);
        ObjectLensType projected = shape.mutableProjection().slice(key);
        return TypeEquality.isIdentical(slice, projected);
    }

    public static boolean isReadonly(ObjectLensType shape, String key) {
        return !isWritable(shape, key);
    }

    public static boolean isWritable(LensType shape, String key) {
        return isWritable(LensTypes.requireShape(shape), key);
    }

    public static boolean isReadonly(LensType shape, String key) {
        return !isWritable(LensTypes.requireShape(shape), key);
    }
}
