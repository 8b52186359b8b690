package com.typelens.compiler.analysis.types;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 数值字面量规范化测试
 */
class NumericLiteralsTest {

    @Test
    @DisplayName("十进制拼写")
    void testDecimal() {
        assertEquals("5", NumericLiterals.canonicalize("5"));
        assertEquals("-5", NumericLiterals.canonicalize("-5"));
        assertEquals("5.2", NumericLiterals.canonicalize("5.2"));
        assertEquals("-5.2", NumericLiterals.canonicalize("-5.2"));
        assertEquals("100", NumericLiterals.canonicalize("100"));
    }

    @Test
    @DisplayName("尾随的小数 0 被去掉")
    void testTrailingZeros() {
        assertEquals("5", NumericLiterals.canonicalize("5.0"));
        assertEquals("5.25", NumericLiterals.canonicalize("5.2500"));
        assertEquals("1", NumericLiterals.canonicalize("1."));
        assertEquals("0.5", NumericLiterals.canonicalize(".5"));
    }

    @Test
    @DisplayName("指数展开为普通十进制")
    void testExponent() {
        assertEquals("1000", NumericLiterals.canonicalize("1e3"));
        assertEquals("0.0015", NumericLiterals.canonicalize("1.5E-3"));
        assertEquals("-250", NumericLiterals.canonicalize("-2.5e+2"));
    }

    @Test
    @DisplayName("0 的各种拼写都规范为 0")
    void testZero() {
        assertEquals("0", NumericLiterals.canonicalize("0"));
        assertEquals("0", NumericLiterals.canonicalize("-0"));
        assertEquals("0", NumericLiterals.canonicalize("0.000"));
        assertEquals("0", NumericLiterals.canonicalize("-0e5"));
        assertEquals("0", NumericLiterals.canonicalize("0x0"));
    }

    @Test
    @DisplayName("进制前缀与分隔符")
    void testRadixAndSeparators() {
        assertEquals("255", NumericLiterals.canonicalize("0xff"));
        assertEquals("-255", NumericLiterals.canonicalize("-0XFF"));
        assertEquals("10", NumericLiterals.canonicalize("0b1010"));
        assertEquals("8", NumericLiterals.canonicalize("0o10"));
        assertEquals("1000000", NumericLiterals.canonicalize("1_000_000"));
    }

    @Test
    @DisplayName("非法拼写")
    void testInvalid() {
        assertThrows(NumberFormatException.class, () -> NumericLiterals.canonicalize(""));
        assertThrows(NumberFormatException.class, () -> NumericLiterals.canonicalize("-"));
        assertThrows(NumberFormatException.class, () -> NumericLiterals.canonicalize("--5"));
        assertThrows(NumberFormatException.class, () -> NumericLiterals.canonicalize("+5"));
        assertThrows(NumberFormatException.class, () -> NumericLiterals.canonicalize("abc"));
        assertThrows(NumberFormatException.class, () -> NumericLiterals.canonicalize("0x"));
    }

    @Test
    @DisplayName("超出位数上限的拼写被拒绝而不是展开")
    void testOutOfRange() {
        assertThrows(NumberFormatException.class, () -> NumericLiterals.canonicalize("1e999999999"));
        assertThrows(NumberFormatException.class, () -> NumericLiterals.canonicalize("-1e-999999999"));
        assertThrows(NumberFormatException.class, () -> NumericLiterals.canonicalize("1e1001"));
        assertEquals(NumericLiterals.MAX_DIGITS + 1, NumericLiterals.canonicalize("1e1000").length());
        assertEquals("0", NumericLiterals.canonicalize("0e999999999"));
    }

    @Test
    @DisplayName("规范形式判断")
    void testIsCanonical() {
        assertTrue(NumericLiterals.isCanonical("-5.2"));
        assertTrue(NumericLiterals.isCanonical("0"));
        assertFalse(NumericLiterals.isCanonical("-0"));
        assertFalse(NumericLiterals.isCanonical("5.0"));
        assertFalse(NumericLiterals.isCanonical("1e3"));
    }
}
