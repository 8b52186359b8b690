package com.typelens.cli;

import com.typelens.compiler.analysis.classify.ZeroSignPolicy;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * picocli eval 子命令：打印文件中每个非泛型别名的求值结果
 */
@Command(name = "eval", description = "求值并打印文件中的类型别名")
public class EvalCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "声明文件（.lens）")
    String file;

    @Option(names = "--zero", defaultValue = "positive", converter = ZeroSignConverter.class,
            description = "字面量 0 的符号归类（positive, unsigned；默认 positive）")
    ZeroSignPolicy zeroSign;

    @Mixin
    VerboseMixin verbose;

    @Override
    public Integer call() {
        return new CheckRunner(new CheckOptions().setZeroSignPolicy(zeroSign)).eval(file);
    }
}
