package com.typelens.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("命令行测试")
class MainTest {

    @TempDir
    Path tempDir;

    private String write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file.toString();
    }

    @Test
    @DisplayName("check 子命令返回检查结果作为退出码")
    void checkExitCode() throws IOException {
        String ok = write("ok.lens", "assert IsInteger<4>\n");
        String bad = write("bad.lens", "assert IsInteger<4.5>\n");
        assertThat(new CommandLine(new Main()).execute("check", ok)).isZero();
        assertThat(new CommandLine(new Main()).execute("check", ok, bad)).isEqualTo(1);
    }

    @Test
    @DisplayName("--zero 选项")
    void zeroOption() throws IOException {
        String file = write("zero.lens", "assert IsPositive<0>\n");
        assertThat(new CommandLine(new Main()).execute("check", "--zero", "positive", file)).isZero();
        assertThat(new CommandLine(new Main()).execute("check", "--zero", "unsigned", file)).isEqualTo(1);
        assertThat(new CommandLine(new Main()).execute("eval", "--zero", "unsigned", file)).isEqualTo(1);
    }

    @Test
    @DisplayName("非法的 --zero 值是用法错误")
    void badZeroValue() throws IOException {
        String file = write("any.lens", "type A = number\n");
        StringWriter errText = new StringWriter();
        CommandLine cmd = new CommandLine(new Main());
        cmd.setErr(new PrintWriter(errText));
        assertThat(cmd.execute("check", "--zero", "signed", file)).isEqualTo(2);
        assertThat(errText.toString()).contains("signed");
    }

    @Test
    @DisplayName("check 需要至少一个文件")
    void missingParameters() {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setErr(new PrintWriter(new StringWriter()));
        assertThat(cmd.execute("check")).isEqualTo(2);
    }

    @Test
    @DisplayName("--version")
    void version() {
        StringWriter outText = new StringWriter();
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(outText));
        assertThat(cmd.execute("--version")).isZero();
        assertThat(outText.toString()).contains("TypeLens v" + ReplRunner.VERSION);
    }

    @Test
    @DisplayName("未闭合括号检测")
    void unclosedBrackets() {
        assertThat(ReplRunner.hasUnclosedBrackets("type S = {")).isTrue();
        assertThat(ReplRunner.hasUnclosedBrackets("type S = { a: number }")).isFalse();
        assertThat(ReplRunner.hasUnclosedBrackets("type F = (x: number) => void")).isFalse();
        assertThat(ReplRunner.hasUnclosedBrackets("type K = \"{\"")).isFalse();
        assertThat(ReplRunner.hasUnclosedBrackets("type B = Box<")).isTrue();
    }

    @Test
    @DisplayName("补全候选包含关键词与工具类型")
    void completionCandidates() {
        assertThat(ReplRunner.completionCandidates())
                .contains("assert", "keyof", "number", "ReadonlyKeys", "PickRequired", ":quit");
    }
}
