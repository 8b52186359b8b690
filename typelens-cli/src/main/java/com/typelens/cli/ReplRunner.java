package com.typelens.cli;

import com.typelens.compiler.analysis.classify.ClassifierOptions;
import com.typelens.compiler.analysis.types.UtilityTypes;
import com.typelens.compiler.lexer.Lexer;
import org.jline.reader.*;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * jline REPL 交互模式
 */
public class ReplRunner {

    static final String VERSION = "0.1.0";

    private final ReplSession session;

    public ReplRunner(ClassifierOptions options) {
        this.session = new ReplSession(options, System.err);
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        printBanner();
        System.out.println("输入 :help 获取帮助，:quit 退出");
        System.out.println();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .completer(new StringsCompleter(completionCandidates()))
                    .variable(LineReader.SECONDARY_PROMPT_PATTERN, "... ")
                    .build();

            runLoop(reader);
        } catch (IOException e) {
            System.err.println("终端初始化失败: " + e.getMessage());
            // 回退到简单模式
            runFallbackLoop();
        }

        System.out.println("\n再见！");
    }

    /**
     * Tab 补全候选：关键词、内置类型名、工具类型名与 REPL 命令
     */
    static List<String> completionCandidates() {
        List<String> candidates = new ArrayList<String>(Lexer.getKeywords());
        candidates.addAll(Arrays.asList("number", "string", "boolean", "bigint", "symbol",
                "undefined", "void", "object", "any", "unknown", "never", "Function"));
        candidates.addAll(UtilityTypes.names());
        candidates.addAll(Arrays.asList(":help", ":quit", ":reset", ":types", ":utils", ":version"));
        return candidates;
    }

    /**
     * jline 主循环
     */
    private void runLoop(LineReader reader) {
        StringBuilder multilineBuffer = new StringBuilder();

        while (true) {
            try {
                String prompt = multilineBuffer.length() > 0 ? "... " : "lens> ";
                String line = reader.readLine(prompt);
                if (line == null) break;
                if (!accept(line, multilineBuffer)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
                multilineBuffer.setLength(0);
            } catch (EndOfFileException e) {
                // Ctrl+D: 退出
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败时使用 BufferedReader）
     */
    private void runFallbackLoop() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        StringBuilder multilineBuffer = new StringBuilder();

        while (true) {
            try {
                System.out.print(multilineBuffer.length() > 0 ? "... " : "lens> ");
                System.out.flush();

                String line = reader.readLine();
                if (line == null) break;
                if (!accept(line, multilineBuffer)) break;
            } catch (IOException e) {
                System.err.println("读取输入时出错: " + e.getMessage());
                break;
            }
        }
    }

    /**
     * 处理一行输入：REPL 命令、续行或完整输入
     *
     * @return false 表示退出
     */
    private boolean accept(String line, StringBuilder multilineBuffer) {
        boolean inMultiline = multilineBuffer.length() > 0;

        if (!inMultiline && line.startsWith(":")) {
            return handleReplCommand(line.trim());
        }

        // 反斜杠续行
        if (line.endsWith("\\")) {
            multilineBuffer.append(line, 0, line.length() - 1).append("\n");
            return true;
        }

        // 未闭合括号自动续行
        if (hasUnclosedBrackets(multilineBuffer.toString() + line)) {
            multilineBuffer.append(line).append("\n");
            return true;
        }

        if (inMultiline) {
            multilineBuffer.append(line);
            line = multilineBuffer.toString();
            multilineBuffer.setLength(0);
        }

        if (line.trim().isEmpty()) return true;

        print(session.evaluate(line));
        return true;
    }

    /**
     * 检查是否有未闭合的括号
     */
    static boolean hasUnclosedBrackets(String text) {
        int depth = 0;
        boolean inString = false;
        char stringChar = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (!inString && (c == '"' || c == '\'')) {
                inString = true;
                stringChar = c;
                continue;
            }
            if (inString) {
                if (c == stringChar && text.charAt(i - 1) != '\\') {
                    inString = false;
                }
                continue;
            }

            switch (c) {
                case '{': case '(': case '[': case '<': depth++; break;
                case '}': case ')': case ']': case '>': depth--; break;
                case '=':
                    // => 不是类型参数的闭合
                    if (i + 1 < text.length() && text.charAt(i + 1) == '>') i++;
                    break;
            }
        }

        return depth > 0;
    }

    /**
     * 处理 REPL 命令
     *
     * @return true 继续循环，false 退出
     */
    private boolean handleReplCommand(String command) {
        if (":quit".equals(command) || ":q".equals(command) || ":exit".equals(command)) {
            return false;
        }

        if (":help".equals(command) || ":h".equals(command)) {
            printReplHelp();
            return true;
        }

        if (":version".equals(command)) {
            System.out.println("TypeLens v" + VERSION);
            System.out.println("Java: " + System.getProperty("java.version"));
            return true;
        }

        if (":reset".equals(command)) {
            session.reset();
            System.out.println("环境已重置");
            return true;
        }

        if (":types".equals(command)) {
            List<String> lines = session.describeTypes();
            if (lines.isEmpty()) {
                System.out.println("（尚未定义类型别名）");
            }
            print(lines);
            return true;
        }

        if (":utils".equals(command)) {
            System.out.println(String.join(", ", UtilityTypes.names()));
            return true;
        }

        System.out.println("未知命令: " + command);
        System.out.println("输入 :help 获取帮助");
        return true;
    }

    private static void print(List<String> lines) {
        for (String line : lines) {
            if (line.startsWith("错误: ")) {
                System.err.println(line);
            } else {
                System.out.println(line);
            }
        }
    }

    private void printBanner() {
        System.out.println("TypeLens v" + VERSION + " - 对象形状与字面量类型分析");
        System.out.println();
    }

    private void printReplHelp() {
        System.out.println("REPL 命令:");
        System.out.println("  :help, :h        显示此帮助");
        System.out.println("  :quit, :q, :exit 退出 REPL");
        System.out.println("  :version         显示版本");
        System.out.println("  :reset           清空已定义的声明");
        System.out.println("  :types           列出已定义的类型别名");
        System.out.println("  :utils           列出内置工具类型");
        System.out.println();
        System.out.println("示例:");
        System.out.println("  type S = { readonly a: number; b?: string; run(): void }");
        System.out.println("  ReadonlyKeys<S>                    求值类型表达式");
        System.out.println("  assert Equal<OptionalKey<S>, \"b\">   断言");
        System.out.println("  const n: PositiveInteger<5> = 5     常量检查");
        System.out.println();
        System.out.println("提示:");
        System.out.println("  - 行尾使用 \\ 可以输入多行");
        System.out.println("  - 未闭合的括号会自动进入多行模式");
    }
}
