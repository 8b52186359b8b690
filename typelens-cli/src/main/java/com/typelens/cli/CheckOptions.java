package com.typelens.cli;

import com.typelens.compiler.analysis.classify.ClassifierOptions;
import com.typelens.compiler.analysis.classify.ZeroSignPolicy;

/**
 * check / eval 的运行选项
 */
public class CheckOptions {

    /** 严格模式：警告也导致非零退出码 */
    private boolean strict = false;

    /** 以 JSON 输出报告 */
    private boolean json = false;

    private final ClassifierOptions classifierOptions = new ClassifierOptions();

    public CheckOptions() {
    }

    public boolean isStrict() {
        return strict;
    }

    public CheckOptions setStrict(boolean strict) {
        this.strict = strict;
        return this;
    }

    public boolean isJson() {
        return json;
    }

    public CheckOptions setJson(boolean json) {
        this.json = json;
        return this;
    }

    public CheckOptions setZeroSignPolicy(ZeroSignPolicy policy) {
        classifierOptions.setZeroSignPolicy(policy);
        return this;
    }

    public ClassifierOptions getClassifierOptions() {
        return classifierOptions;
    }
}
