package com.typelens.compiler.analysis.types;

import java.util.Objects;

/**
 * 字面量类型: 5, -3.5, "name", true
 *
 * <p>数值字面量以规范文本表示（见 {@link NumericLiterals#canonicalize(String)}），
 * 字符串字面量以未转义的内容表示。</p>
 */
public final class LiteralLensType extends LensType {

    public enum Kind {
        NUMBER, STRING, BOOLEAN
    }

    private final Kind kind;
    private final String text;

    LiteralLensType(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    public Kind getKind() {
        return kind;
    }

    /** 数值字面量的规范文本 / 字符串内容 / "true" 或 "false" */
    public String getText() {
        return text;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public boolean isBoolean() {
        return kind == Kind.BOOLEAN;
    }

    /** 字面量拓宽后的原始类型 */
    public PrimitiveLensType widen() {
        switch (kind) {
            case NUMBER: return LensTypes.NUMBER;
            case STRING: return LensTypes.STRING;
            default: return LensTypes.BOOLEAN;
        }
    }

    @Override
    public String getTypeName() {
        return null;
    }

    @Override
    public String toDisplayString() {
        if (kind == Kind.STRING) {
            return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
        return text;
    }

    @Override
    public <R> R accept(LensTypeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LiteralLensType)) return false;
        LiteralLensType that = (LiteralLensType) o;
        return kind == that.kind && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text);
    }
}
