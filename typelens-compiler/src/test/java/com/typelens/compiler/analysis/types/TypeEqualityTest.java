package com.typelens.compiler.analysis.types;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.typelens.compiler.analysis.types.LensTypes.*;
import static com.typelens.compiler.analysis.types.TypeEquality.isIdentical;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 类型相同性测试
 */
class TypeEqualityTest {

    @Test
    @DisplayName("readonly 不同的形状互相可赋值但不相同")
    void testReadonlyDistinguishes() {
        ObjectLensType ro = object(new MemberSignature("a", NUMBER, true, false, false));
        ObjectLensType rw = object(MemberSignature.property("a", NUMBER));
        assertTrue(TypeCompatibility.isMutuallyAssignable(ro, rw));
        assertFalse(isIdentical(ro, rw));
    }

    @Test
    @DisplayName("可选性不同的形状不相同")
    void testOptionalDistinguishes() {
        ObjectLensType opt = object(new MemberSignature("a", STRING, false, true, false));
        ObjectLensType req = object(MemberSignature.property("a", union(STRING, UNDEFINED)));
        assertFalse(isIdentical(opt, req));
    }

    @Test
    @DisplayName("成员顺序无关")
    void testMemberOrder() {
        ObjectLensType ab = object(MemberSignature.property("a", NUMBER), MemberSignature.property("b", STRING));
        ObjectLensType ba = object(MemberSignature.property("b", STRING), MemberSignature.property("a", NUMBER));
        assertTrue(isIdentical(ab, ba));
    }

    @Test
    @DisplayName("方法与函数属性相同")
    void testMethodFlagIgnored() {
        ObjectLensType method = object(new MemberSignature("run", function(VOID), false, false, true));
        ObjectLensType property = object(MemberSignature.property("run", function(VOID)));
        assertTrue(isIdentical(method, property));
    }

    @Test
    @DisplayName("嵌套形状逐层比较")
    void testNested() {
        ObjectLensType inner1 = object(new MemberSignature("x", NUMBER, true, false, false));
        ObjectLensType inner2 = object(MemberSignature.property("x", NUMBER));
        assertFalse(isIdentical(object(MemberSignature.property("o", inner1)),
                object(MemberSignature.property("o", inner2))));
        assertTrue(isIdentical(object(MemberSignature.property("o", inner1)),
                object(MemberSignature.property("o", inner1))));
    }

    @Test
    @DisplayName("索引签名")
    void testIndexSignature() {
        ObjectLensType dictNumber = new ObjectLensType(Collections.<MemberSignature>emptyList(), NUMBER);
        ObjectLensType dictString = new ObjectLensType(Collections.<MemberSignature>emptyList(), STRING);
        assertFalse(isIdentical(dictNumber, dictString));
        assertFalse(isIdentical(dictNumber, EMPTY_OBJECT));
        assertTrue(isIdentical(dictNumber, new ObjectLensType(Collections.<MemberSignature>emptyList(), NUMBER)));
    }

    @Test
    @DisplayName("联合、字面量与原始类型")
    void testUnionsAndLiterals() {
        assertTrue(isIdentical(union(STRING, NUMBER), union(NUMBER, STRING)));
        assertFalse(isIdentical(union(STRING, NUMBER), STRING));
        assertTrue(isIdentical(numberLiteral("5.0"), numberLiteral("5")));
        assertFalse(isIdentical(numberLiteral("5"), NUMBER));
        assertFalse(isIdentical(ANY, UNKNOWN));
        assertTrue(isIdentical(NEVER, NEVER));
    }

    @Test
    @DisplayName("函数参数的可选与剩余标记")
    void testFunctionParams() {
        FunctionLensType required = new FunctionLensType(Arrays.asList(
                new FunctionLensType.Param("a", NUMBER, false, false)), VOID, false);
        FunctionLensType renamed = new FunctionLensType(Arrays.asList(
                new FunctionLensType.Param("b", NUMBER, false, false)), VOID, false);
        FunctionLensType optional = new FunctionLensType(Arrays.asList(
                new FunctionLensType.Param("a", NUMBER, true, false)), VOID, false);
        assertTrue(isIdentical(required, renamed));
        assertFalse(isIdentical(required, optional));
    }

    @Test
    @DisplayName("数组的只读标记")
    void testArrays() {
        assertFalse(isIdentical(arrayOf(NUMBER), readonlyArrayOf(NUMBER)));
        assertTrue(isIdentical(arrayOf(NUMBER), arrayOf(NUMBER)));
    }
}
