package com.typelens.compiler.analysis.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

/**
 * 数值字面量的规范文本形式。
 *
 * <p>规范形式：十进制、无指数、无前导 "+"、小数部分无尾随 0、
 * 单个 "." 作为小数分隔符，负数以 "-" 开头，-0 写作 "0"。</p>
 */
public final class NumericLiterals {

    /** 规范文本允许的最大有效位数与小数点位移 */
    static final int MAX_DIGITS = 1000;

    private NumericLiterals() {}

    /**
     * 将源码拼写（可含 "-" 前缀、"_" 分隔符、0x/0b/0o 前缀、指数）转换为规范文本。
     *
     * @throws NumberFormatException 拼写不是合法的数值字面量，或展开后超过 {@link #MAX_DIGITS} 位
     */
    public static String canonicalize(String spelling) {
        if (spelling == null || spelling.isEmpty()) {
            throw new NumberFormatException("Empty numeric literal");
        }
        String text = spelling.indexOf('_') >= 0 ? spelling.replace("_", "") : spelling;
        boolean negative = false;
        if (text.startsWith("-")) {
            negative = true;
            text = text.substring(1);
        }
        if (text.isEmpty() || text.charAt(0) == '+' || text.charAt(0) == '-') {
            throw new NumberFormatException("Invalid numeric literal: " + spelling);
        }

        BigDecimal value;
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0x")) {
            value = new BigDecimal(new BigInteger(text.substring(2), 16));
        } else if (lower.startsWith("0b")) {
            value = new BigDecimal(new BigInteger(text.substring(2), 2));
        } else if (lower.startsWith("0o")) {
            value = new BigDecimal(new BigInteger(text.substring(2), 8));
        } else {
            value = new BigDecimal(text);
        }

        if (value.signum() == 0) return "0";
        BigDecimal stripped = value.stripTrailingZeros();
        // 展开前限制位数
        if (stripped.precision() > MAX_DIGITS || Math.abs((long) stripped.scale()) > MAX_DIGITS) {
            throw new NumberFormatException("Numeric literal out of range: " + spelling);
        }
        String plain = stripped.toPlainString();
        return negative ? "-" + plain : plain;
    }

    /** 文本是否已是规范形式 */
    public static boolean isCanonical(String text) {
        try {
            return canonicalize(text).equals(text);
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
