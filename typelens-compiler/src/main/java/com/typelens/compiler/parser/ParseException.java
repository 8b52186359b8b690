package com.typelens.compiler.parser;

import com.typelens.compiler.lexer.Token;
import com.typelens.compiler.lexer.TokenType;

/**
 * 解析异常
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final TokenType expected;

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    public ParseException(String message, Token token, TokenType expected) {
        super(message);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    /** 期望的 token 类型，未知时为 null */
    public TokenType getExpected() {
        return expected;
    }

    /** 不含位置信息的原始消息 */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            if (token.getType() == TokenType.EOF) {
                sb.append(" (found end of input)");
            } else {
                sb.append(" (found '").append(token.getLexeme()).append("')");
            }
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
