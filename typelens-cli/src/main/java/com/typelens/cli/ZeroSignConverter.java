package com.typelens.cli;

import com.typelens.compiler.analysis.classify.ZeroSignPolicy;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * --zero 参数转换
 */
public class ZeroSignConverter implements ITypeConverter<ZeroSignPolicy> {

    @Override
    public ZeroSignPolicy convert(String value) {
        ZeroSignPolicy policy = ZeroSignPolicy.fromName(value);
        if (policy == null) {
            throw new TypeConversionException("未知的 0 符号归类 '" + value + "'（可选: positive, unsigned）");
        }
        return policy;
    }
}
