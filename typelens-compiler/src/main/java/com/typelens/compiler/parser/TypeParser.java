package com.typelens.compiler.parser;

import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.expr.Literal;
import com.typelens.compiler.ast.type.*;
import com.typelens.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.typelens.compiler.lexer.TokenType.*;

/**
 * 类型解析辅助类
 *
 * <pre>
 * type         := '|'? intersection ('|' intersection)*
 * intersection := operator ('&amp;' operator)*
 * operator     := 'keyof' operator | 'readonly' postfix | postfix
 * postfix      := primary ('[' ']' | '[' type ']')*
 * primary      := literal | name typeArgs? | object | function | 'new' function | '(' type ')'
 * </pre>
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    TypeRef parseType() {
        SourceLocation loc = parser.location();
        parser.match(PIPE); // 允许前导 |

        List<TypeRef> alternatives = new ArrayList<TypeRef>();
        alternatives.add(parseIntersection());
        while (parser.match(PIPE)) {
            alternatives.add(parseIntersection());
        }
        if (alternatives.size() == 1) return alternatives.get(0);
        return new UnionType(loc, alternatives);
    }

    private TypeRef parseIntersection() {
        SourceLocation loc = parser.location();
        List<TypeRef> parts = new ArrayList<TypeRef>();
        parts.add(parseTypeOperator());
        while (parser.match(AMP)) {
            parts.add(parseTypeOperator());
        }
        if (parts.size() == 1) return parts.get(0);
        return new IntersectionType(loc, parts);
    }

    private TypeRef parseTypeOperator() {
        SourceLocation loc = parser.location();

        if (parser.match(KW_KEYOF)) {
            return new KeyofType(loc, parseTypeOperator());
        }

        if (parser.check(KW_READONLY)) {
            parser.advance();
            TypeRef operand = parsePostfix();
            if (!(operand instanceof ArrayType) || ((ArrayType) operand).isReadonly()) {
                throw new ParseException("'readonly' type modifier is only permitted on array types",
                        parser.previous);
            }
            return new ArrayType(loc, ((ArrayType) operand).getElementType(), true);
        }

        return parsePostfix();
    }

    private TypeRef parsePostfix() {
        SourceLocation loc = parser.location();
        TypeRef type = parsePrimary();

        while (parser.check(LBRACKET)) {
            parser.advance();
            if (parser.match(RBRACKET)) {
                type = new ArrayType(loc, type, false);
            } else {
                TypeRef index = parseType();
                parser.expect(RBRACKET, "Expected ']'");
                type = new IndexedAccessType(loc, type, index);
            }
        }
        return type;
    }

    private TypeRef parsePrimary() {
        SourceLocation loc = parser.location();

        // 字面量类型
        if (parser.literalHelper.isLiteralStart()) {
            Literal literal = parser.literalHelper.parseLiteral(false);
            return new LiteralType(literal.getLocation(), literal);
        }

        // 类型名或泛型应用
        if (parser.check(IDENTIFIER)) {
            String name = parser.advance().getLexeme();
            if (parser.check(LT)) {
                return new GenericType(loc, name, parseTypeArgs());
            }
            return new SimpleType(loc, name);
        }

        // 对象类型
        if (parser.check(LBRACE)) {
            return parseObjectType();
        }

        // 构造签名
        if (parser.match(KW_NEW)) {
            return parseFunctionRest(loc, true);
        }

        // 函数类型或括号
        if (parser.check(LPAREN)) {
            return parseFunctionTypeOrParenthesized(loc);
        }

        throw new ParseException("Expected type", parser.current);
    }

    private List<TypeRef> parseTypeArgs() {
        parser.expect(LT, "Expected '<'");
        List<TypeRef> args = new ArrayList<TypeRef>();
        do {
            args.add(parseType());
        } while (parser.match(COMMA));
        parser.expect(GT, "Expected '>'");
        return args;
    }

    /**
     * '(' 开头：先尝试按函数类型解析，失败则回溯为括号类型
     */
    private TypeRef parseFunctionTypeOrParenthesized(SourceLocation loc) {
        parser.mark();
        try {
            TypeRef fn = parseFunctionRest(loc, false);
            parser.commitMark();
            return fn;
        } catch (ParseException e) {
            parser.reset();
        }

        parser.expect(LPAREN, "Expected '('");
        TypeRef inner = parseType();
        parser.expect(RPAREN, "Expected ')'");
        return inner;
    }

    /**
     * (params) =&gt; ReturnType
     */
    private FunctionType parseFunctionRest(SourceLocation loc, boolean constructor) {
        List<Parameter> params = parseParams();
        parser.expect(ARROW, "Expected '=>' in function type");
        TypeRef returnType = parseType();
        return new FunctionType(loc, params, returnType, constructor);
    }

    private List<Parameter> parseParams() {
        parser.expect(LPAREN, "Expected '('");
        List<Parameter> params = new ArrayList<Parameter>();
        if (!parser.check(RPAREN)) {
            do {
                if (!params.isEmpty() && params.get(params.size() - 1).isRest()) {
                    throw new ParseException("A rest parameter must be last in a parameter list", parser.current);
                }
                params.add(parseParam());
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')'");
        return params;
    }

    private Parameter parseParam() {
        SourceLocation loc = parser.location();
        boolean rest = parser.match(ELLIPSIS);
        String name = parser.expectName("Expected parameter name");
        boolean optional = parser.match(QUESTION);
        parser.expect(COLON, "Expected ':' after parameter name");
        TypeRef type = parseType();
        return new Parameter(loc, name, type, optional, rest);
    }

    // ============ 对象类型 ============

    private ObjectType parseObjectType() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");

        List<PropertySignature> members = new ArrayList<PropertySignature>();
        List<String> seen = new ArrayList<String>();
        TypeRef indexType = null;

        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            if (parser.check(LBRACKET)) {
                if (indexType != null) {
                    throw new ParseException("Duplicate index signature", parser.current);
                }
                indexType = parseIndexSignature();
            } else {
                PropertySignature member = parseMember();
                if (seen.contains(member.getName())) {
                    throw new ParseException("Duplicate member '" + member.getName() + "'", parser.previous);
                }
                seen.add(member.getName());
                members.add(member);
            }
            if (!parser.match(SEMICOLON) && !parser.match(COMMA) && !parser.check(RBRACE)) {
                throw new ParseException("Expected ';' between members", parser.current, SEMICOLON);
            }
        }

        parser.expect(RBRACE, "Expected '}'");
        return new ObjectType(loc, members, indexType);
    }

    /**
     * [key: string]: Type
     */
    private TypeRef parseIndexSignature() {
        parser.expect(LBRACKET, "Expected '['");
        parser.expectName("Expected index parameter name");
        parser.expect(COLON, "Expected ':'");
        if (!parser.check(IDENTIFIER) || !"string".equals(parser.current.getLexeme())) {
            throw new ParseException("Only 'string' index signatures are supported", parser.current);
        }
        parser.advance();
        parser.expect(RBRACKET, "Expected ']'");
        parser.expect(COLON, "Expected ':' after index signature");
        return parseType();
    }

    private PropertySignature parseMember() {
        SourceLocation loc = parser.location();

        // 'readonly' 后面紧跟成员名时才是修饰符，否则它本身就是成员名
        boolean readonly = false;
        if (parser.check(KW_READONLY) && isMemberNameStart(parser.peek().getType())) {
            parser.advance();
            readonly = true;
        }

        String name = parseMemberName();
        boolean optional = parser.match(QUESTION);

        if (parser.check(LPAREN)) {
            SourceLocation fnLoc = parser.location();
            List<Parameter> params = parseParams();
            parser.expect(COLON, "Expected ':' and a return type after method parameters");
            TypeRef returnType = parseType();
            return new PropertySignature(loc, name, new FunctionType(fnLoc, params, returnType, false),
                    readonly, optional, true);
        }

        parser.expect(COLON, "Expected ':' after member name");
        TypeRef type = parseType();
        return new PropertySignature(loc, name, type, readonly, optional, false);
    }

    private String parseMemberName() {
        if (parser.check(STRING_LITERAL) || parser.check(NUMBER_LITERAL)) {
            return parser.advance().getLiteralText();
        }
        return parser.expectName("Expected member name");
    }

    private static boolean isMemberNameStart(TokenType type) {
        return type == IDENTIFIER || type == STRING_LITERAL || type == NUMBER_LITERAL || type.isKeyword();
    }
}
