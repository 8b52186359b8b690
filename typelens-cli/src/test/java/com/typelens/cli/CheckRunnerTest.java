package com.typelens.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.typelens.compiler.analysis.SemanticDiagnostic;
import com.typelens.compiler.analysis.classify.ZeroSignPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CheckRunner 测试")
class CheckRunnerTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;

    @BeforeEach
    void setUp() {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
    }

    private CheckRunner runner(CheckOptions options) throws IOException {
        return new CheckRunner(options,
                new PrintStream(outBytes, true, "UTF-8"),
                new PrintStream(errBytes, true, "UTF-8"));
    }

    private String out() {
        return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private String write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file.toString();
    }

    // ============ check ============

    @Nested
    @DisplayName("check")
    class CheckTests {

        @Test
        @DisplayName("全部断言通过时退出码为 0")
        void passingFile() throws IOException {
            String file = write("ok.lens",
                    "type S = { readonly a: number; b?: string; run(): void }\n"
                            + "assert Equal<ReadonlyKeys<S>, \"a\">\n"
                            + "assert Equal<OptionalKeys<S>, \"b\">\n");
            int code = runner(new CheckOptions()).check(Collections.singletonList(file));
            assertThat(code).isZero();
            assertThat(out()).contains("1 个文件，0 个错误，0 个警告");
            assertThat(err()).isEmpty();
        }

        @Test
        @DisplayName("失败的断言打印诊断并返回 1")
        void failingFile() throws IOException {
            String file = write("bad.lens", "assert Equal<1, 2>\n");
            int code = runner(new CheckOptions()).check(Collections.singletonList(file));
            assertThat(code).isEqualTo(1);
            assertThat(err()).contains("bad.lens:1:").contains("断言失败");
            assertThat(out()).contains("1 个错误");
        }

        @Test
        @DisplayName("语法错误之后仍然分析其余声明")
        void syntaxErrorsAreTolerated() throws IOException {
            String file = write("mixed.lens", "type A = ;\nassert Equal<1, 2>\n");
            CheckRunner.FileReport report = runner(new CheckOptions()).checkFile(file);
            assertThat(report.count(SemanticDiagnostic.Severity.ERROR)).isEqualTo(2);
            assertThat(report.getAnalysis()).isNotNull();
        }

        @Test
        @DisplayName("指数过大的数值字面量是语法错误")
        void hugeExponent() throws IOException {
            CheckRunner.FileReport report = runner(new CheckOptions())
                    .checkSource("assert IsPositive<1e999999999>\nassert IsPositive<1>\n", "huge.lens");
            assertThat(report.count(SemanticDiagnostic.Severity.ERROR)).isPositive();
            assertThat(err()).contains("Invalid numeric literal");
        }

        @Test
        @DisplayName("严格模式下警告也失败")
        void strictMode() throws IOException {
            String file = write("warn.lens", "type Partial = number\n");
            assertThat(runner(new CheckOptions()).check(Collections.singletonList(file))).isZero();
            assertThat(runner(new CheckOptions().setStrict(true)).check(Collections.singletonList(file)))
                    .isEqualTo(1);
        }

        @Test
        @DisplayName("文件不存在")
        void missingFile() throws IOException {
            String missing = tempDir.resolve("nope.lens").toString();
            int code = runner(new CheckOptions()).check(Collections.singletonList(missing));
            assertThat(code).isEqualTo(1);
            assertThat(err()).contains("文件不存在");
        }

        @Test
        @DisplayName("多个文件汇总计数")
        void multipleFiles() throws IOException {
            String a = write("a.lens", "assert IsPositiveInteger<3>\n");
            String b = write("b.lens", "const x: string = 1\n");
            int code = runner(new CheckOptions()).check(Arrays.asList(a, b));
            assertThat(code).isEqualTo(1);
            assertThat(out()).contains("2 个文件，1 个错误");
        }

        @Test
        @DisplayName("0 的符号归类影响结果")
        void zeroSignPolicy() throws IOException {
            String file = write("zero.lens", "assert IsPositive<0>\n");
            assertThat(runner(new CheckOptions()).check(Collections.singletonList(file))).isZero();
            assertThat(runner(new CheckOptions().setZeroSignPolicy(ZeroSignPolicy.UNSIGNED))
                    .check(Collections.singletonList(file))).isEqualTo(1);
        }
    }

    // ============ JSON ============

    @Nested
    @DisplayName("JSON 报告")
    class JsonTests {

        @Test
        @DisplayName("报告包含诊断、别名与选项")
        void jsonReport() throws IOException {
            String file = write("report.lens", "type K = \"x\" | \"y\"\nconst n: number = \"s\"\n");
            int code = runner(new CheckOptions().setJson(true)).check(Collections.singletonList(file));
            assertThat(code).isEqualTo(1);
            assertThat(err()).isEmpty();

            JsonObject root = JsonParser.parseString(out()).getAsJsonObject();
            assertThat(root.get("errors").getAsInt()).isEqualTo(1);
            assertThat(root.get("warnings").getAsInt()).isZero();
            assertThat(root.get("strict").getAsBoolean()).isFalse();
            assertThat(root.get("zeroSign").getAsString()).isEqualTo("positive");

            JsonArray files = root.getAsJsonArray("files");
            assertThat(files.size()).isEqualTo(1);
            JsonObject report = files.get(0).getAsJsonObject();
            assertThat(report.get("file").getAsString()).isEqualTo("report.lens");
            assertThat(report.getAsJsonObject("aliases").get("K").getAsString()).isEqualTo("\"x\" | \"y\"");

            JsonObject diag = report.getAsJsonArray("diagnostics").get(0).getAsJsonObject();
            assertThat(diag.get("severity").getAsString()).isEqualTo("error");
            assertThat(diag.get("line").getAsInt()).isEqualTo(2);
            assertThat(diag.get("length").getAsInt()).isPositive();
            assertThat(diag.get("message").getAsString()).contains("不能赋给类型 'number'");
        }

        @Test
        @DisplayName("无法读取的文件没有别名")
        void unreadableFileHasEmptyAliases() throws IOException {
            String missing = tempDir.resolve("nope.lens").toString();
            runner(new CheckOptions().setJson(true)).check(Collections.singletonList(missing));
            JsonObject report = JsonParser.parseString(out()).getAsJsonObject()
                    .getAsJsonArray("files").get(0).getAsJsonObject();
            assertThat(report.getAsJsonObject("aliases").size()).isZero();
            assertThat(report.get("file").getAsString()).isEqualTo(missing);
        }
    }

    // ============ eval ============

    @Nested
    @DisplayName("eval")
    class EvalTests {

        @Test
        @DisplayName("打印每个非泛型别名")
        void evalAliases() throws IOException {
            String file = write("eval.lens",
                    "type S = { readonly a: number; b?: string }\n"
                            + "type W = WritableKeys<S>\n"
                            + "type Box<T> = { value: T }\n");
            int code = runner(new CheckOptions()).eval(file);
            assertThat(code).isZero();
            assertThat(out())
                    .contains("type S = { readonly a: number; b?: string }")
                    .contains("type W = \"b\"")
                    .doesNotContain("Box");
        }

        @Test
        @DisplayName("错误时返回 1")
        void evalWithErrors() throws IOException {
            String file = write("eval-bad.lens", "type X = Missing\n");
            assertThat(runner(new CheckOptions()).eval(file)).isEqualTo(1);
            assertThat(err()).contains("未知类型 'Missing'");
        }
    }
}
