package com.roadmanlang.compiler.parser;

import com.roadmanlang.compiler.ast.SourceLocation;
import com.roadmanlang.compiler.ast.decl.FunDecl;
import com.roadmanlang.compiler.ast.decl.VarDecl;
import com.roadmanlang.compiler.ast.expr.Expression;
import com.roadmanlang.compiler.ast.stmt.Block;
import com.roadmanlang.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.List;

import static com.roadmanlang.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类：conste / gimme / fam
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 声明或语句
     */
    Statement parseDeclaration() {
        if (parser.match(KW_CONSTE)) {
            return parseVarDecl(true);
        }
        if (parser.match(KW_GIMME)) {
            return parseVarDecl(false);
        }
        if (parser.match(KW_FAM)) {
            return parseFunDecl();
        }
        return parser.stmtParser.parseStatement();
    }

    private VarDecl parseVarDecl(boolean isConstant) {
        SourceLocation loc = parser.previousLocation();
        String name = parser.expect(IDENTIFIER, "Expect variable name.").getLexeme();

        Expression initializer = null;
        if (parser.match(ASSIGN)) {
            initializer = parser.exprParser.parseExpression();
        }

        parser.expect(SEMICOLON, "Expect ';' after variable declaration.");
        return new VarDecl(loc, name, initializer, isConstant);
    }

    private FunDecl parseFunDecl() {
        SourceLocation loc = parser.previousLocation();
        String name = parser.expect(IDENTIFIER, "Expect function name.").getLexeme();
        parser.expect(LPAREN, "Expect '(' after function name.");

        List<String> params = new ArrayList<String>();
        if (!parser.check(RPAREN)) {
            do {
                params.add(parser.expect(IDENTIFIER, "Expect parameter name.").getLexeme());
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expect ')' after parameters.");

        if (!parser.check(LBRACE)) {
            throw new ParseException("Expect '{' before function body.", parser.current);
        }

        // 函数体内不能 stopit 外层循环
        int enclosingLoopDepth = parser.loopDepth;
        parser.loopDepth = 0;
        try {
            Block body = parser.stmtParser.parseBlock();
            return new FunDecl(loc, name, params, body);
        } finally {
            parser.loopDepth = enclosingLoopDepth;
        }
    }
}
