package com.typelens.compiler.analysis.classify;

import com.typelens.compiler.analysis.types.LensType;
import com.typelens.compiler.analysis.types.LensTypes;
import com.typelens.compiler.analysis.types.LiteralLensType;
import com.typelens.compiler.analysis.types.TypeQueryException;

/**
 * 数值字面量类型分类：整数 / 正数 / 负数。
 *
 * <p>纯文本判断，只检查字面量的规范文本（是否以 "-" 开头、是否含 "."），从不比较数值大小。</p>
 */
public final class NumericLiteralClassifier {

    private final ZeroSignPolicy zeroSignPolicy;

    public NumericLiteralClassifier(ClassifierOptions options) {
        this.zeroSignPolicy = options.getZeroSignPolicy();
    }

    public NumericLiteralClassifier() {
        this(new ClassifierOptions());
    }

    public ZeroSignPolicy getZeroSignPolicy() {
        return zeroSignPolicy;
    }

    public boolean isInteger(LensType type) {
        return canonicalText(type).indexOf('.') < 0;
    }

    public boolean isNegative(LensType type) {
        return canonicalText(type).startsWith("-");
    }

    public boolean isPositive(LensType type) {
        String text = canonicalText(type);
        if (text.startsWith("-")) return false;
        return !("0".equals(text) && zeroSignPolicy == ZeroSignPolicy.UNSIGNED);
    }

    public boolean isPositiveInteger(LensType type) {
        return isPositive(type) && isInteger(type);
    }

    public boolean isNegativeInteger(LensType type) {
        return isNegative(type) && isInteger(type);
    }

    // ============ 收窄：满足时返回原类型，否则 never ============

    public LensType narrowInteger(LensType type) {
        return isInteger(type) ? type : LensTypes.NEVER;
    }

    public LensType narrowPositiveInteger(LensType type) {
        return isPositiveInteger(type) ? type : LensTypes.NEVER;
    }

    public LensType narrowNegativeInteger(LensType type) {
        return isNegativeInteger(type) ? type : LensTypes.NEVER;
    }

    /**
     * 取单个数值字面量类型的规范文本，其他类型（number、联合、字符串字面量等）抛出 NOT_A_NUMERIC_LITERAL。
     */
    static String canonicalText(LensType type) {
        if (type instanceof LiteralLensType && ((LiteralLensType) type).isNumber()) {
            return ((LiteralLensType) type).getText();
        }
        throw new TypeQueryException(TypeQueryException.Kind.NOT_A_NUMERIC_LITERAL,
                "类型 '" + type.toDisplayString() + "' 不是单个数值字面量类型");
    }
}
