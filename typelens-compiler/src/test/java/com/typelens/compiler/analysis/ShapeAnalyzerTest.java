package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.classify.ClassifierOptions;
import com.typelens.compiler.analysis.classify.ZeroSignPolicy;
import com.typelens.compiler.analysis.types.ErrorType;
import com.typelens.compiler.analysis.types.LensTypes;
import com.typelens.compiler.ast.decl.Program;
import com.typelens.compiler.lexer.Lexer;
import com.typelens.compiler.parser.Parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ShapeAnalyzer 端到端测试：源码 → 解析 → 分析 → 诊断
 */
class ShapeAnalyzerTest {

    private static final String SAMPLE = "type S = { readonly a: number; b?: string; run(): void }\n";

    private AnalysisResult analyze(String source) {
        return analyze(source, new ClassifierOptions());
    }

    private AnalysisResult analyze(String source, ClassifierOptions options) {
        Parser parser = new Parser(new Lexer(source, "<test>"), "<test>");
        Program program = parser.parse();
        return new ShapeAnalyzer(options).analyze(program);
    }

    private void assertClean(String source) {
        AnalysisResult result = analyze(source);
        assertTrue(result.getDiagnostics().isEmpty(), "Unexpected diagnostics: " + result.getDiagnostics());
    }

    private SemanticDiagnostic singleError(String source) {
        List<SemanticDiagnostic> errors = analyze(source).getDiagnostics(SemanticDiagnostic.Severity.ERROR);
        assertEquals(1, errors.size(), "Expected exactly one error: " + errors);
        return errors.get(0);
    }

    // ============ 断言 ============

    @Nested
    @DisplayName("断言")
    class AssertTests {

        @Test
        @DisplayName("示例形状的键集合")
        void testSampleKeySets() {
            assertClean(SAMPLE
                    + "assert Equal<ReadonlyKeys<S>, \"a\">\n"
                    + "assert Equal<WritableKeys<S>, \"b\" | \"run\">\n"
                    + "assert Equal<OptionalKeys<S>, \"b\">\n"
                    + "assert Equal<RequiredKeys<S>, \"a\" | \"run\">\n"
                    + "assert Equal<FunctionKeys<S>, \"run\">\n"
                    + "assert Equal<NonFunctionKeys<S>, \"a\" | \"b\">\n"
                    + "assert Equal<PickRequired<S>, { readonly a: number; run(): void }>\n");
        }

        @Test
        @DisplayName("失败的断言报告求值结果")
        void testFailingAssert() {
            SemanticDiagnostic error = singleError(SAMPLE + "assert IsWritable<S, \"a\">");
            assertEquals("断言失败: 类型求值为 'false'，期望 'true'", error.getMessage());
            assertEquals(2, error.getLocation().getLine());
        }

        @Test
        @DisplayName("非布尔结果的断言失败")
        void testNonBooleanAssert() {
            SemanticDiagnostic error = singleError("assert number");
            assertTrue(error.getMessage().contains("'number'"));
        }

        @Test
        @DisplayName("readonly 使 Equal 为 false，Mutable 之后为 true")
        void testEqualReadonly() {
            assertClean("assert Equal<Equal<{ readonly a: number }, { a: number }>, false>\n"
                    + "assert Equal<Mutable<{ readonly a: number }>, { a: number }>\n"
                    + "assert Equal<Readonly<{ a: number }>, { readonly a: number }>");
        }

        @Test
        @DisplayName("数值字面量谓词")
        void testNumericPredicates() {
            assertClean("assert IsPositiveInteger<5>\n"
                    + "assert IsNegativeInteger<-5>\n"
                    + "assert Equal<IsInteger<5.2>, false>\n"
                    + "assert IsNegative<-5.2>\n"
                    + "assert Equal<PositiveInteger<-3>, never>\n"
                    + "assert IsPositive<0>");
        }

        @Test
        @DisplayName("UNSIGNED 策略下 0 不是正数")
        void testUnsignedZero() {
            ClassifierOptions options = new ClassifierOptions();
            options.setZeroSignPolicy(ZeroSignPolicy.UNSIGNED);
            AnalysisResult result = analyze("assert Equal<IsPositive<0>, false>\n"
                    + "assert Equal<IsNegative<0>, false>", options);
            assertFalse(result.hasErrors(), result.getDiagnostics().toString());
        }
    }

    // ============ 类型运算 ============

    @Nested
    @DisplayName("类型运算")
    class OperatorTests {

        @Test
        @DisplayName("keyof 与索引访问")
        void testKeyofAndIndexedAccess() {
            assertClean(SAMPLE
                    + "assert Equal<keyof S, \"a\" | \"b\" | \"run\">\n"
                    + "assert Equal<S[\"b\"], string | undefined>\n"
                    + "assert Equal<S[\"a\" | \"b\"], number | string | undefined>\n"
                    + "assert Equal<keyof { [k: string]: number }, string>\n"
                    + "assert Equal<number[][number], number>");
        }

        @Test
        @DisplayName("交叉类型合并形状，冲突为 never")
        void testIntersection() {
            assertClean("assert Equal<{ a: number } & { b: string }, { a: number; b: string }>\n"
                    + "assert Equal<{ a: string } & { a: number }, never>");
        }

        @Test
        @DisplayName("交叉类型只支持对象形状")
        void testIntersectionOfPrimitive() {
            SemanticDiagnostic error = singleError("type X = string & { a: number }");
            assertTrue(error.getMessage().startsWith("交叉类型: "));
        }

        @Test
        @DisplayName("不存在的键")
        void testUnknownKey() {
            SemanticDiagnostic error = singleError(SAMPLE + "type X = S[\"zzz\"]");
            assertTrue(error.getMessage().contains("'zzz'"));
        }

        @Test
        @DisplayName("泛型别名实例化")
        void testGenericAlias() {
            assertClean("type Box<T> = { value: T }\n"
                    + "type Pair<A, B> = { first: Box<A>; second: B }\n"
                    + "assert Equal<Box<number>[\"value\"], number>\n"
                    + "assert Equal<Pair<string, 1>[\"first\"], { value: string }>");
        }
    }

    // ============ 声明检查 ============

    @Nested
    @DisplayName("声明检查")
    class DeclarationTests {

        @Test
        @DisplayName("类型别名提升")
        void testHoisting() {
            assertClean("assert Equal<Later, number>\ntype Later = number");
        }

        @Test
        @DisplayName("求值后的别名")
        void testEvaluatedAliases() {
            AnalysisResult result = analyze(SAMPLE + "type K = ReadonlyKeys<S>\ntype G<T> = T");
            assertEquals("\"a\"", result.getAliasType("K").toDisplayString());
            assertEquals("{ readonly a: number; b?: string; run(): void }",
                    result.getAliasType("S").toDisplayString());
            assertFalse(result.getEvaluatedAliases().containsKey("G"));
            assertNotNull(result.getSymbolTable().lookup("G", SymbolKind.TYPE_ALIAS));
        }

        @Test
        @DisplayName("重复的类型别名")
        void testDuplicateAlias() {
            SemanticDiagnostic error = singleError("type A = number\ntype A = string");
            assertEquals("类型别名 'A' 重复定义（首次定义于第 1 行）", error.getMessage());
            assertEquals(2, error.getLocation().getLine());
        }

        @Test
        @DisplayName("内置类型名不能作为别名")
        void testBuiltinName() {
            SemanticDiagnostic error = singleError("type number = string");
            assertTrue(error.getMessage().contains("内置类型名"));
        }

        @Test
        @DisplayName("遮蔽工具类型只产生警告")
        void testShadowUtility() {
            AnalysisResult result = analyze("type Partial = number\nassert Equal<Partial, number>");
            assertFalse(result.hasErrors(), result.getDiagnostics().toString());
            assertEquals(1, result.getDiagnostics(SemanticDiagnostic.Severity.WARNING).size());
        }

        @Test
        @DisplayName("未知类型")
        void testUnknownType() {
            SemanticDiagnostic error = singleError("type X = { a: Missing }");
            assertEquals("未知类型 'Missing'", error.getMessage());
        }

        @Test
        @DisplayName("未使用的泛型别名中的未知类型")
        void testUnusedGenericAlias() {
            SemanticDiagnostic error = singleError("type G<T> = { a: T; b: Missing }");
            assertEquals("未知类型 'Missing'", error.getMessage());
        }

        @Test
        @DisplayName("工具类型参数个数")
        void testUtilityArity() {
            SemanticDiagnostic error = singleError(SAMPLE + "type P = Pick<S>");
            assertEquals("工具类型 'Pick' 需要 2 个类型参数，实际为 1", error.getMessage());
        }

        @Test
        @DisplayName("泛型别名参数个数")
        void testGenericArity() {
            assertTrue(singleError("type Box<T> = { v: T }\ntype X = Box").getMessage().contains("需要 1 个类型参数"));
            assertTrue(singleError("type Box<T> = { v: T }\ntype X = Box<1, 2>").getMessage().contains("实际为 2"));
        }

        @Test
        @DisplayName("循环别名")
        void testCircularAlias() {
            assertTrue(singleError("type A = B\ntype B = A").getMessage().contains("循环引用"));
            assertTrue(singleError("type Node = { next: Node }").getMessage().contains("循环引用"));
        }

        @Test
        @DisplayName("工具类型错误转换为诊断")
        void testUtilityError() {
            SemanticDiagnostic error = singleError("type K = KeysWithValueType<{ a: string }, number>");
            assertTrue(error.getMessage().startsWith("KeysWithValueType: "));

            SemanticDiagnostic numeric = singleError("type N = Integer<number>");
            assertTrue(numeric.getMessage().startsWith("Integer: "));
        }

        @Test
        @DisplayName("错误类型向外传播但只报告一次")
        void testErrorPropagation() {
            AnalysisResult result = analyze("type U = Missing\ntype V = Mutable<U>\nassert Equal<V, {}>");
            assertEquals(1, result.getDiagnostics().size(), result.getDiagnostics().toString());
            assertTrue(result.getAliasType("V") instanceof ErrorType);
        }
    }

    // ============ 常量 ============

    @Nested
    @DisplayName("常量")
    class ConstTests {

        @Test
        @DisplayName("字面量可赋给声明类型")
        void testValidConst() {
            assertClean("const n: PositiveInteger<3> = 3\n"
                    + "const s: \"a\" | \"b\" = \"b\"\n"
                    + "const u: string | undefined = undefined\n"
                    + "const z: Falsy = 0");
        }

        @Test
        @DisplayName("类型不匹配")
        void testMismatch() {
            SemanticDiagnostic error = singleError("const x: string = 5");
            assertEquals("类型 '5' 不能赋给类型 'string'", error.getMessage());
        }

        @Test
        @DisplayName("类型为 never 的常量")
        void testNeverConst() {
            SemanticDiagnostic error = singleError("const x: NegativeInteger<3> = 3");
            assertTrue(error.getMessage().contains("never"));
        }

        @Test
        @DisplayName("重复的常量")
        void testDuplicateConst() {
            SemanticDiagnostic error = singleError("const x: number = 1\nconst x: number = 2");
            assertTrue(error.getMessage().contains("重复定义"));
        }

        @Test
        @DisplayName("常量与类型别名在不同命名空间")
        void testSeparateNamespaces() {
            AnalysisResult result = analyze("type x = number\nconst x: x = 1");
            assertFalse(result.hasErrors(), result.getDiagnostics().toString());
            assertEquals(LensTypes.NUMBER,
                    result.getSymbolTable().lookup("x", SymbolKind.CONST).getResolvedType());
        }
    }
}
