package com.typelens.compiler.parser;

import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Literal;
import com.typelens.compiler.lexer.Token;

import static com.typelens.compiler.lexer.TokenType.*;

/**
 * 字面量解析辅助类：值字面量与字面量类型共用
 */
class LiteralHelper {

    final Parser parser;

    LiteralHelper(Parser parser) {
        this.parser = parser;
    }

    /**
     * 当前 token 是否可以开始一个字面量（含负数）
     */
    boolean isLiteralStart() {
        return parser.checkAny(NUMBER_LITERAL, STRING_LITERAL, KW_TRUE, KW_FALSE, KW_NULL)
                || (parser.check(MINUS) && parser.checkAhead(NUMBER_LITERAL));
    }

    /**
     * 解析字面量: 5, -3.5, "a", true, false, null；allowUndefined 时接受 undefined
     */
    Literal parseLiteral(boolean allowUndefined) {
        SourceLocation loc = parser.location();

        if (parser.match(MINUS)) {
            Token number = parser.expect(NUMBER_LITERAL, "Expected number after '-'");
            return new Literal(loc.spanTo(parser.previousLocation()),
                    negate(number.getLiteralText()), Literal.LiteralKind.NUMBER);
        }
        if (parser.check(NUMBER_LITERAL)) {
            return new Literal(loc, parser.advance().getLiteralText(), Literal.LiteralKind.NUMBER);
        }
        if (parser.check(STRING_LITERAL)) {
            return new Literal(loc, parser.advance().getLiteralText(), Literal.LiteralKind.STRING);
        }
        if (parser.match(KW_TRUE)) {
            return new Literal(loc, "true", Literal.LiteralKind.BOOLEAN);
        }
        if (parser.match(KW_FALSE)) {
            return new Literal(loc, "false", Literal.LiteralKind.BOOLEAN);
        }
        if (parser.match(KW_NULL)) {
            return new Literal(loc, "null", Literal.LiteralKind.NULL);
        }
        if (allowUndefined && parser.check(IDENTIFIER) && "undefined".equals(parser.current.getLexeme())) {
            parser.advance();
            return new Literal(loc, "undefined", Literal.LiteralKind.UNDEFINED);
        }
        throw new ParseException("Expected literal", parser.current);
    }

    /** 规范文本取负；-0 仍为 0 */
    static String negate(String canonical) {
        if ("0".equals(canonical)) return canonical;
        if (canonical.startsWith("-")) return canonical.substring(1);
        return "-" + canonical;
    }
}
