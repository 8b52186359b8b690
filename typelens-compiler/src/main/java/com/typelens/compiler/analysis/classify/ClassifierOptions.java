package com.typelens.compiler.analysis.classify;

/**
 * 分类器配置
 */
public class ClassifierOptions {
    private ZeroSignPolicy zeroSignPolicy = ZeroSignPolicy.POSITIVE;

    public ClassifierOptions() {
    }

    public ZeroSignPolicy getZeroSignPolicy() {
        return zeroSignPolicy;
    }

    public void setZeroSignPolicy(ZeroSignPolicy zeroSignPolicy) {
        this.zeroSignPolicy = zeroSignPolicy != null ? zeroSignPolicy : ZeroSignPolicy.POSITIVE;
    }
}
