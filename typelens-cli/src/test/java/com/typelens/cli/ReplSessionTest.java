package com.typelens.cli;

import com.typelens.compiler.analysis.classify.ClassifierOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ReplSession 测试")
class ReplSessionTest {

    private ReplSession session;

    @BeforeEach
    void setUp() {
        session = new ReplSession(new ClassifierOptions(), new PrintStream(new ByteArrayOutputStream()));
    }

    @Test
    @DisplayName("声明别名后可以在后续输入中使用")
    void declareThenUse() {
        assertThat(session.evaluate("type S = { readonly a: number; b?: string; run(): void }"))
                .containsExactly("type S = { readonly a: number; b?: string; run(): void }");
        assertThat(session.evaluate("ReadonlyKeys<S>")).containsExactly("\"a\"");
        assertThat(session.evaluate("FunctionKeys<S>")).containsExactly("\"run\"");
        assertThat(session.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("泛型别名、常量与断言")
    void otherDeclarations() {
        assertThat(session.evaluate("type Box<T> = { value: T }")).containsExactly("type Box<T> 已定义");
        assertThat(session.evaluate("const n: PositiveInteger<3> = 3")).containsExactly("const n: 3");
        assertThat(session.evaluate("assert Equal<Box<1>[\"value\"], 1>")).containsExactly("断言通过");
        assertThat(session.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("有错误的声明不会被接受")
    void rejectErrors() {
        assertThat(session.evaluate("type X = Missing")).containsExactly("错误: 未知类型 'Missing'");
        assertThat(session.size()).isZero();
        assertThat(session.evaluate("assert Equal<1, 2>")).singleElement().asString().startsWith("错误: 断言失败");
        assertThat(session.size()).isZero();
    }

    @Test
    @DisplayName("重新声明替换旧定义")
    void redeclare() {
        session.evaluate("type A = number");
        assertThat(session.evaluate("type A = string")).containsExactly("type A = string");
        assertThat(session.size()).isEqualTo(1);
        assertThat(session.describeTypes()).containsExactly("type A = string");
    }

    @Test
    @DisplayName("破坏已有声明的重新声明不会被接受")
    void redeclareBreakingDependent() {
        session.evaluate("type A = { x: number }");
        assertThat(session.evaluate("type B = Pick<A, \"x\">")).containsExactly("type B = { x: number }");

        assertThat(session.evaluate("type A = { y: number }"))
                .singleElement().asString()
                .startsWith("错误: <input#2>:")
                .contains("Pick")
                .contains("'x'");
        assertThat(session.size()).isEqualTo(2);
        assertThat(session.describeTypes()).containsExactly("type A = { x: number }", "type B = { x: number }");
    }

    @Test
    @DisplayName("使已有断言失败的重新声明不会被接受")
    void redeclareBreakingAssert() {
        session.evaluate("type N = 3");
        assertThat(session.evaluate("assert IsPositive<N>")).containsExactly("断言通过");
        assertThat(session.evaluate("type N = -3"))
                .singleElement().asString().contains("断言失败");
        assertThat(session.evaluate("N")).containsExactly("3");
    }

    @Test
    @DisplayName("语法错误与空输入")
    void syntaxErrorsAndEmptyInput() {
        assertThat(session.evaluate("type = 1")).singleElement().asString().startsWith("错误: ");
        assertThat(session.evaluate("   ")).isEmpty();
    }

    @Test
    @DisplayName("警告随结果一起输出")
    void warnings() {
        assertThat(session.evaluate("type Partial = number"))
                .hasSize(2)
                .first().asString().startsWith("警告: ");
    }

    @Test
    @DisplayName("reset 清空会话")
    void reset() {
        session.evaluate("type A = number");
        session.reset();
        assertThat(session.size()).isZero();
        assertThat(session.evaluate("A")).containsExactly("错误: 未知类型 'A'");
    }
}
