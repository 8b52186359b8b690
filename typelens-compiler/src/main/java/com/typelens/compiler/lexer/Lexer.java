package com.typelens.compiler.lexer;

import com.typelens.compiler.analysis.types.NumericLiterals;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TypeLens 声明语言词法分析器
 */
public class Lexer {
    private String source;  // non-final: 解析完成后可释放
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    private final PrintStream errStream;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("type", TokenType.KW_TYPE);
        map.put("const", TokenType.KW_CONST);
        map.put("assert", TokenType.KW_ASSERT);

        // 类型操作
        map.put("readonly", TokenType.KW_READONLY);
        map.put("keyof", TokenType.KW_KEYOF);
        map.put("new", TokenType.KW_NEW);

        // 字面量
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("null", TokenType.KW_NULL);
        // "undefined"/"number" 等内置类型名是普通标识符，由 TypeResolver 识别

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合（供 REPL 补全等外部工具使用） */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this(source, fileName, System.err);
    }

    public Lexer(String source, String fileName, PrintStream errStream) {
        this.source = source;
        this.fileName = fileName;
        this.errStream = errStream;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    /** 释放源码字符串引用（解析完成后调用） */
    public void releaseSource() {
        source = null;
    }

    /**
     * 获取下一个 Token（流式接口）
     *
     * @return 下一个 Token
     */
    public Token nextToken() {
        while (true) {
            skipWhitespace();

            if (isAtEnd()) {
                return new Token(TokenType.EOF, "", null, line, column, current);
            }

            start = current;
            scanToken();

            if (!tokens.isEmpty()) {
                return tokens.remove(tokens.size() - 1);
            }
            // 注释不产生 token，继续扫描
        }
    }

    /**
     * 执行词法分析，返回 Token 列表
     */
    public List<Token> scanTokens() {
        while (true) {
            skipWhitespace();
            if (isAtEnd()) break;
            start = current;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return tokens;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '\n') {
                advance();
                newLine();
            } else {
                break;
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case '<': addToken(TokenType.LT); break;
            case '>': addToken(TokenType.GT); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ':': addToken(TokenType.COLON); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '|': addToken(TokenType.PIPE); break;
            case '&': addToken(TokenType.AMP); break;

            case '.':
                if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    addToken(TokenType.ELLIPSIS);
                } else if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case '=':
                addToken(match('>') ? TokenType.ARROW : TokenType.ASSIGN);
                break;

            case '-':
                addToken(TokenType.MINUS);
                break;

            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    // 多行注释
                    blockComment();
                } else {
                    error("Unexpected character '/'");
                }
                break;

            // 字符串
            case '"':
            case '\'':
                string(c);
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' || c == '$' ||
               Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        int tokenColumn = column - (current - start);
        tokens.add(new Token(type, lexeme, literal, line, tokenColumn, start));
    }

    // === 复杂 Token 扫描 ===

    private void string(char quote) {
        StringBuilder value = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\n') {
                error("Unterminated string");
                return;
            }
            if (peek() == '\\') {
                advance();
                value.append(escapeChar());
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }

        advance(); // 闭合的引号
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private char escapeChar() {
        if (isAtEnd()) {
            error("Unterminated escape sequence");
            return '\0';
        }
        char c = advance();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case '0': return '\0';
            case '\\': return '\\';
            case '"': return '"';
            case '\'': return '\'';
            case 'u':
                StringBuilder hex = new StringBuilder();
                for (int i = 0; i < 4; i++) {
                    if (isAtEnd()) {
                        error("Invalid unicode escape");
                        return '\0';
                    }
                    hex.append(advance());
                }
                try {
                    return (char) Integer.parseInt(hex.toString(), 16);
                } catch (NumberFormatException e) {
                    error("Invalid unicode escape: \\u" + hex);
                    return '\0';
                }
            default:
                error("Invalid escape character: \\" + c);
                return c;
        }
    }

    /** 消耗数字字符和下划线分隔符 */
    private void advanceDigits() {
        while (isDigit(peek()) || peek() == '_') advance();
    }

    private void number() {
        // 检查进制
        if (source.charAt(start) == '0' && !isAtEnd()) {
            char next = Character.toLowerCase(peek());
            if (next == 'x' || next == 'b' || next == 'o') {
                advance();
                while (isAlphaNumeric(peek())) advance();
                addNumber();
                return;
            }
        }

        advanceDigits();

        // 小数部分（"1." 也是合法拼写）
        if (peek() == '.' && peekNext() != '.') {
            advance();
            advanceDigits();
        }

        // 指数部分
        if (peek() == 'e' || peek() == 'E') {
            advance();
            if (peek() == '+' || peek() == '-') advance();
            advanceDigits();
        }

        addNumber();
    }

    private void addNumber() {
        String text = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER_LITERAL, NumericLiterals.canonicalize(text));
        } catch (NumberFormatException e) {
            error("Invalid numeric literal: " + text);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (peek() == '\n') {
                advance();
                newLine();
            } else {
                advance();
            }
        }
        error("Unterminated block comment");
    }

    private void error(String message) {
        String errorMsg = String.format("[%s:%d:%d] Lexer error: %s",
                fileName, line, column, message);
        errStream.println(errorMsg);
        addToken(TokenType.ERROR, message);
    }
}
