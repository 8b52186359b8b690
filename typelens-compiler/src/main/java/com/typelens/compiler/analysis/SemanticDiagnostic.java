package com.typelens.compiler.analysis;

import com.typelens.compiler.ast.SourceLocation;

/**
 * 语义诊断条目
 */
public final class SemanticDiagnostic {

    public enum Severity {
        ERROR, WARNING, INFO, HINT
    }

    private final Severity severity;
    private final String message;
    private final SourceLocation location;

    public SemanticDiagnostic(Severity severity, String message, SourceLocation location) {
        this.severity = severity;
        this.message = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }
    public int getLength() { return Math.max(location.getLength(), 1); }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /** 同一位置、同一消息视为重复诊断 */
    public boolean sameAs(Severity severity, String message, SourceLocation location) {
        return this.severity == severity && this.message.equals(message)
                && this.location.getFile().equals(location.getFile())
                && this.location.getOffset() == location.getOffset();
    }

    @Override
    public String toString() {
        return location + ": " + severity.name().toLowerCase() + ": " + message;
    }
}
