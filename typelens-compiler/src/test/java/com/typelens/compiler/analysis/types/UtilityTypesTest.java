package com.typelens.compiler.analysis.types;

import com.typelens.compiler.analysis.classify.NumericLiteralClassifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.typelens.compiler.analysis.types.LensTypes.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 工具类型目录测试（直接调用，不经过解析）
 */
class UtilityTypesTest {

    private final UtilityTypes utilities = new UtilityTypes(new NumericLiteralClassifier());

    private static List<LensType> args(LensType... types) {
        return Arrays.asList(types);
    }

    /** { readonly a: number; b?: string; run(): void } */
    private static ObjectLensType sample() {
        return object(
                new MemberSignature("a", NUMBER, true, false, false),
                new MemberSignature("b", STRING, false, true, false),
                new MemberSignature("run", function(VOID), false, false, true));
    }

    @Test
    @DisplayName("参数个数")
    void testArity() {
        assertEquals(0, UtilityTypes.minArity("Falsy"));
        assertEquals(0, UtilityTypes.maxArity("Primitive"));
        assertEquals(0, UtilityTypes.minArity("ConstructorType"));
        assertEquals(1, UtilityTypes.maxArity("InstantiableClass"));
        assertEquals(2, UtilityTypes.minArity("Pick"));
        assertEquals(3, UtilityTypes.maxArity("IsValueType"));
        assertEquals(1, UtilityTypes.minArity("ReadonlyKeys"));
        assertTrue(UtilityTypes.isUtility("NonFuncKey"));
        assertFalse(UtilityTypes.isUtility("Record"));
    }

    @Test
    @DisplayName("别名名称给出相同结果")
    void testSynonyms() {
        assertEquals(utilities.apply("NonReadonly", args(sample())), utilities.apply("WritableKeys", args(sample())));
        assertEquals(utilities.apply("FuncKey", args(sample())), utilities.apply("FunctionKeys", args(sample())));
        assertEquals(utilities.apply("OptionalKey", args(sample())), stringLiteral("b"));
    }

    @Test
    @DisplayName("键集合工具返回字符串字面量联合")
    void testKeySets() {
        assertEquals(stringLiteral("a"), utilities.apply("ReadonlyKeys", args(sample())));
        assertEquals(union(stringLiteral("b"), stringLiteral("run")), utilities.apply("WritableKeys", args(sample())));
        assertEquals(union(stringLiteral("a"), stringLiteral("b")), utilities.apply("NonFuncKey", args(sample())));
        assertSame(NEVER, utilities.apply("ReadonlyKeys", args(EMPTY_OBJECT)));
    }

    @Test
    @DisplayName("KeysWithValueType 在非空形状上无匹配时报错，空形状返回 never")
    void testKeysWithValueType() {
        assertEquals(stringLiteral("a"), utilities.apply("KeysWithValueType", args(sample(), NUMBER)));
        TypeQueryException e = assertThrows(TypeQueryException.class,
                () -> utilities.apply("KeysWithValueType", args(sample(), BIGINT)));
        assertEquals(TypeQueryException.Kind.INCOMPATIBLE_CATEGORY, e.getKind());
        assertSame(NEVER, utilities.apply("KeysWithValueType", args(EMPTY_OBJECT, BIGINT)));
    }

    @Test
    @DisplayName("谓词返回 true / false 字面量")
    void testPredicates() {
        assertEquals(TRUE, utilities.apply("IsReadonly", args(sample(), stringLiteral("a"))));
        assertEquals(FALSE, utilities.apply("IsWritable", args(sample(), stringLiteral("a"))));
        assertEquals(TRUE, utilities.apply("IsOptional", args(sample(), stringLiteral("b"))));
        assertEquals(TRUE, utilities.apply("IsFunction", args(sample(), stringLiteral("run"))));
        assertEquals(TRUE, utilities.apply("IsValueType", args(sample(), stringLiteral("a"), NUMBER)));
        assertEquals(FALSE, utilities.apply("Equal", args(sample(), sample().mutableProjection())));
        assertEquals(TRUE, utilities.apply("IsNegativeInteger", args(numberLiteral("-7"))));
    }

    @Test
    @DisplayName("单键谓词拒绝键联合")
    void testSingleKey() {
        TypeQueryException e = assertThrows(TypeQueryException.class,
                () -> utilities.apply("IsReadonly", args(sample(), union(stringLiteral("a"), stringLiteral("b")))));
        assertEquals(TypeQueryException.Kind.NOT_A_KEY_SET, e.getKind());
    }

    @Test
    @DisplayName("数值收窄")
    void testNumericNarrowing() {
        assertEquals(numberLiteral("4"), utilities.apply("PositiveInteger", args(numberLiteral("4"))));
        assertSame(NEVER, utilities.apply("NegativeInteger", args(numberLiteral("4"))));
        TypeQueryException e = assertThrows(TypeQueryException.class,
                () -> utilities.apply("Integer", args(NUMBER)));
        assertEquals(TypeQueryException.Kind.NOT_A_NUMERIC_LITERAL, e.getKind());
    }

    @Test
    @DisplayName("别名与访问器")
    void testAliases() {
        assertEquals(union(STRING, NULL), utilities.apply("Nullable", args(STRING)));
        assertEquals(union(STRING, NULL, UNDEFINED), utilities.apply("Nullish", args(STRING)));
        assertEquals(STRING, utilities.apply("NonIndefinable", args(union(STRING, UNDEFINED))));
        assertEquals(union(NUMBER, STRING, UNDEFINED),
                utilities.apply("PropertyType", args(sample(), union(stringLiteral("a"), stringLiteral("b")))));
        assertEquals(NUMBER, utilities.apply("ArrayItem", args(arrayOf(NUMBER))));
        assertEquals(constructorOf(ANY), utilities.apply("ConstructorType", Collections.<LensType>emptyList()));
        assertEquals(constructorOf(EMPTY_OBJECT), utilities.apply("InstantiableClass", args(EMPTY_OBJECT)));
        assertEquals(readonlyArrayOf(STRING), utilities.apply("Readonly", args(arrayOf(STRING))));
        assertEquals("{ [key: string]: number }", utilities.apply("PlainObject", args(NUMBER)).toDisplayString());
    }

    @Test
    @DisplayName("非法参数种类")
    void testBadArguments() {
        TypeQueryException notShape = assertThrows(TypeQueryException.class,
                () -> utilities.apply("Mutable", args(NUMBER)));
        assertEquals(TypeQueryException.Kind.NOT_AN_OBJECT_SHAPE, notShape.getKind());

        TypeQueryException notArray = assertThrows(TypeQueryException.class,
                () -> utilities.apply("ArrayItem", args(STRING)));
        assertEquals(TypeQueryException.Kind.BAD_ARGUMENT, notArray.getKind());

        TypeQueryException notKeys = assertThrows(TypeQueryException.class,
                () -> utilities.apply("Pick", args(sample(), STRING)));
        assertEquals(TypeQueryException.Kind.NOT_A_KEY_SET, notKeys.getKind());
    }
}
