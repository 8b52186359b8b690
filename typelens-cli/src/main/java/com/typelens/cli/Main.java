package com.typelens.cli;

import com.typelens.compiler.analysis.classify.ClassifierOptions;
import com.typelens.compiler.analysis.classify.ZeroSignPolicy;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.logging.Level;

/**
 * TypeLens CLI 入口点（picocli）；不带子命令时进入 REPL
 */
@Command(name = "typelens", version = "TypeLens v" + ReplRunner.VERSION,
         mixinStandardHelpOptions = true,
         subcommands = {CheckCommand.class, EvalCommand.class})
public class Main implements Runnable {

    @Option(names = "--zero", defaultValue = "positive", converter = ZeroSignConverter.class,
            description = "字面量 0 的符号归类（positive, unsigned；默认 positive）")
    ZeroSignPolicy zeroSign;

    @Mixin
    VerboseMixin verbose;

    @Override
    public void run() {
        ClassifierOptions options = new ClassifierOptions();
        options.setZeroSignPolicy(zeroSign);
        new ReplRunner(options).run();
    }

    public static void main(String[] args) {
        VerboseMixin.configureLogging(Level.WARNING);

        // Windows 控制台可能仍用 GBK，使用 native.encoding 确保中文正确显示
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * 获取控制台实际使用的字符编码名（native.encoding 反映操作系统原生编码）。
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
