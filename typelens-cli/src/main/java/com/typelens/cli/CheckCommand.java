package com.typelens.cli;

import com.typelens.compiler.analysis.classify.ZeroSignPolicy;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli check 子命令：检查声明文件
 */
@Command(name = "check", description = "检查声明文件（assert / const / 类型别名）")
public class CheckCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "声明文件（.lens）")
    List<String> files;

    @Option(names = "--strict", description = "严格模式：警告也导致检查失败")
    boolean strict;

    @Option(names = "--json", description = "以 JSON 输出报告")
    boolean json;

    @Option(names = "--zero", defaultValue = "positive", converter = ZeroSignConverter.class,
            description = "字面量 0 的符号归类（positive, unsigned；默认 positive）")
    ZeroSignPolicy zeroSign;

    @Mixin
    VerboseMixin verbose;

    @Override
    public Integer call() {
        CheckOptions options = new CheckOptions()
                .setStrict(strict)
                .setJson(json)
                .setZeroSignPolicy(zeroSign);
        return new CheckRunner(options).check(files);
    }
}
