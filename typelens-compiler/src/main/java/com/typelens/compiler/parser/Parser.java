package com.typelens.compiler.parser;

import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.decl.Declaration;
import com.typelens.compiler.ast.decl.Program;
import com.typelens.compiler.ast.type.TypeRef;
import com.typelens.compiler.lexer.Lexer;
import com.typelens.compiler.lexer.Token;
import com.typelens.compiler.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static com.typelens.compiler.lexer.TokenType.*;

/**
 * TypeLens 声明语言语法分析器（递归下降）
 */
@SuppressWarnings("this-escape")
public class Parser {

    final Lexer lexer;
    final String fileName;
    Token current;
    Token previous;
    private Token nextToken;  // 用于 lookahead 的缓冲
    private final Deque<Token> replayQueue = new ArrayDeque<Token>(); // 回放队列

    // mark/reset 回溯支持，可嵌套：每层 mark 记住自己在记录缓冲中的起点
    private final List<Token> markRecordBuffer = new ArrayList<Token>(8);
    private final Deque<Integer> markStarts = new ArrayDeque<Integer>();
    private final Deque<Token> markedPrevious = new ArrayDeque<Token>();

    // === Helper 实例 ===
    final LiteralHelper literalHelper = new LiteralHelper(this);
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);

    public Parser(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
        advance();  // 读取第一个 token
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (nextToken != null) {
            current = nextToken;
            nextToken = null;
        } else if (!replayQueue.isEmpty()) {
            current = replayQueue.poll();
        } else {
            current = lexer.nextToken();
        }
        // 回溯模式下记录消费的 token
        if (!markStarts.isEmpty() && previous != null) {
            markRecordBuffer.add(previous);
        }
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        if (nextToken == null) {
            if (!replayQueue.isEmpty()) {
                nextToken = replayQueue.poll();
            } else {
                nextToken = lexer.nextToken();
            }
        }
        return nextToken;
    }

    /**
     * 标记当前位置，用于回溯
     */
    void mark() {
        markStarts.push(markRecordBuffer.size());
        markedPrevious.push(previous == null ? current : previous);
    }

    /**
     * 回溯到标记的位置
     */
    void reset() {
        // 将 nextToken + current 放回 replayQueue 前端，再把 markRecord 按逆序插入最前
        if (nextToken != null) {
            replayQueue.addFirst(nextToken);
            nextToken = null;
        }
        replayQueue.addFirst(current);
        int start = markStarts.pop();
        for (int i = markRecordBuffer.size() - 1; i >= start; i--) {
            replayQueue.addFirst(markRecordBuffer.remove(i));
        }

        current = replayQueue.poll();
        previous = markedPrevious.pop();
        if (markStarts.isEmpty()) markRecordBuffer.clear();
    }

    /**
     * 提交标记（放弃回溯能力）
     */
    void commitMark() {
        markStarts.pop();
        markedPrevious.pop();
        if (markStarts.isEmpty()) markRecordBuffer.clear();
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /** 检查下一个 token 的类型（不消费） */
    boolean checkAhead(TokenType type) {
        return peek().getType() == type;
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type);
    }

    /**
     * 解析名称：标识符或关键字（成员名、参数名允许使用关键字，如 { type: string }）
     */
    String expectName(String message) {
        if (check(IDENTIFIER) || current.getType().isKeyword()) {
            return advance().getLexeme();
        }
        throw new ParseException(message, current, IDENTIFIER);
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return new SourceLocation(fileName, current.getLine(), current.getColumn(),
                current.getOffset(), current.getLexeme().length());
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return new SourceLocation(fileName, previous.getLine(), previous.getColumn(),
                previous.getOffset(), previous.getLexeme().length());
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    void skipSeparators() {
        while (match(SEMICOLON)) {
            // 跳过多余的分号
        }
    }

    /**
     * 检查当前 token 是否是声明开头
     */
    boolean isDeclarationStart() {
        return current.getType().isDeclarationKeyword();
    }

    // ============ 程序解析 ============

    /**
     * 解析程序，遇到第一个语法错误时抛出 ParseException
     */
    public Program parse() {
        SourceLocation loc = location();
        List<Declaration> declarations = new ArrayList<Declaration>();
        skipSeparators();
        while (!isAtEnd()) {
            declarations.add(parseDeclaration());
            skipSeparators();
        }
        lexer.releaseSource(); // 解析完成，释放源码字符串
        return new Program(loc, declarations);
    }

    /**
     * 容错解析：遇到错误时跳过到下一个声明继续解析。
     * 返回的 ParseResult 包含已成功解析的声明和收集到的错误列表。
     */
    public ParseResult parseTolerant() {
        SourceLocation loc = location();
        List<Declaration> declarations = new ArrayList<Declaration>();
        List<ParseError> errors = new ArrayList<ParseError>();
        skipSeparators();
        while (!isAtEnd()) {
            try {
                declarations.add(parseDeclaration());
            } catch (ParseException e) {
                errors.add(new ParseError(e.getMessage(), e.getToken()));
                synchronize();
            }
            skipSeparators();
        }
        lexer.releaseSource();
        return new ParseResult(new Program(loc, declarations), errors);
    }

    /**
     * 错误恢复：跳过 token 直到找到下一个声明起始点。
     */
    private void synchronize() {
        advance(); // 跳过触发错误的 token
        while (!isAtEnd()) {
            if (isDeclarationStart()) return;
            advance();
        }
    }

    /**
     * 解析 REPL 输入：声明，或者一个待求值的裸类型表达式
     *
     * @return Declaration、TypeRef，空输入返回 null
     */
    public AstNode parseReplInput() {
        skipSeparators();
        if (isAtEnd()) return null;

        AstNode node;
        if (isDeclarationStart()) {
            node = parseDeclaration();
        } else {
            node = parseType();
        }
        skipSeparators();
        if (!isAtEnd()) {
            throw new ParseException("Unexpected trailing input", current);
        }
        return node;
    }

    // ============ 委托 ============

    Declaration parseDeclaration() {
        return declParser.parseDeclaration();
    }

    /** 解析单个类型表达式 */
    public TypeRef parseType() {
        return typeParser.parseType();
    }
}
