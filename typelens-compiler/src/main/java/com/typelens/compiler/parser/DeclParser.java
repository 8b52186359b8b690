package com.typelens.compiler.parser;

import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.ast.decl.AssertDecl;
import com.typelens.compiler.ast.decl.ConstDecl;
import com.typelens.compiler.ast.decl.Declaration;
import com.typelens.compiler.ast.decl.TypeAliasDecl;
import com.typelens.compiler.ast.expr.Literal;
import com.typelens.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.typelens.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    Declaration parseDeclaration() {
        Declaration decl;
        if (parser.check(KW_TYPE)) {
            decl = parseTypeAlias();
        } else if (parser.check(KW_CONST)) {
            decl = parseConst();
        } else if (parser.check(KW_ASSERT)) {
            decl = parseAssert();
        } else {
            throw new ParseException("Expected declaration ('type', 'const' or 'assert')", parser.current);
        }
        // 分号可省略
        parser.match(SEMICOLON);
        return decl;
    }

    /**
     * type Name&lt;T, U&gt; = Type
     */
    private TypeAliasDecl parseTypeAlias() {
        SourceLocation loc = parser.location();
        parser.expect(KW_TYPE, "Expected 'type'");
        String name = parser.expect(IDENTIFIER, "Expected type alias name").getLexeme();

        List<String> typeParams = Collections.emptyList();
        if (parser.match(LT)) {
            typeParams = new ArrayList<String>();
            do {
                String param = parser.expect(IDENTIFIER, "Expected type parameter name").getLexeme();
                if (typeParams.contains(param)) {
                    throw new ParseException("Duplicate type parameter '" + param + "'", parser.previous);
                }
                typeParams.add(param);
            } while (parser.match(COMMA));
            parser.expect(GT, "Expected '>'");
        }

        parser.expect(ASSIGN, "Expected '=' after type alias name");
        TypeRef aliased = parser.parseType();
        return new TypeAliasDecl(loc, name, typeParams, aliased);
    }

    /**
     * const name: Type = literal
     */
    private ConstDecl parseConst() {
        SourceLocation loc = parser.location();
        parser.expect(KW_CONST, "Expected 'const'");
        String name = parser.expect(IDENTIFIER, "Expected constant name").getLexeme();
        parser.expect(COLON, "Expected ':' and a type annotation after constant name");
        TypeRef type = parser.parseType();
        parser.expect(ASSIGN, "Expected '=' after constant type");
        Literal init = parser.literalHelper.parseLiteral(true);
        return new ConstDecl(loc, name, type, init);
    }

    /**
     * assert Type
     */
    private AssertDecl parseAssert() {
        SourceLocation loc = parser.location();
        parser.expect(KW_ASSERT, "Expected 'assert'");
        TypeRef condition = parser.parseType();
        return new AssertDecl(loc, condition);
    }
}
