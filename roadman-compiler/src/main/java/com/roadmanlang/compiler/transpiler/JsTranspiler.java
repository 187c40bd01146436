package com.roadmanlang.compiler.transpiler;

import com.roadmanlang.compiler.ast.AstVisitor;
import com.roadmanlang.compiler.ast.decl.*;
import com.roadmanlang.compiler.ast.expr.*;
import com.roadmanlang.compiler.ast.stmt.*;

import java.util.List;

/**
 * Roadman AST 到 JavaScript 的转译器
 *
 * <p>纯函数式遍历：不做语义检查，对任何解析得到的 AST 都不会失败。
 * 括号只来自源码中的分组表达式。</p>
 */
public class JsTranspiler implements AstVisitor<Void, TranspilerContext> {

    /**
     * 转译程序
     */
    public String transpile(Program program, TranspileConfig config) {
        TranspilerContext ctx = new TranspilerContext(config);
        program.accept(this, ctx);
        return ctx.getOutput();
    }

    /**
     * 使用默认配置（两空格缩进）转译
     */
    public String transpile(Program program) {
        return transpile(program, new TranspileConfig());
    }

    @Override
    public Void visitProgram(Program node, TranspilerContext ctx) {
        List<Statement> statements = node.getStatements();
        for (int i = 0; i < statements.size(); i++) {
            if (i > 0) ctx.newLine();
            statements.get(i).accept(this, ctx);
        }
        return null;
    }

    // ============ 声明 ============

    @Override
    public Void visitVarDecl(VarDecl node, TranspilerContext ctx) {
        ctx.append(node.isConstant() ? "const " : "let ");
        ctx.append(node.getName());
        if (node.hasInitializer()) {
            ctx.append(" = ");
            formatExpression(node.getInitializer(), ctx);
        }
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitFunDecl(FunDecl node, TranspilerContext ctx) {
        ctx.append("function ");
        ctx.append(node.getName());
        ctx.append("(");
        ctx.append(String.join(", ", node.getParams()));
        ctx.append(") ");
        formatBlock(node.getBody(), ctx);
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, TranspilerContext ctx) {
        formatExpression(node.getExpression(), ctx);
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitBlock(Block node, TranspilerContext ctx) {
        formatBlock(node, ctx);
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, TranspilerContext ctx) {
        ctx.append("if (");
        formatExpression(node.getCondition(), ctx);
        ctx.append(") ");
        node.getThenBranch().accept(this, ctx);

        if (node.hasElse()) {
            ctx.append(" else ");
            node.getElseBranch().accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, TranspilerContext ctx) {
        ctx.append("while (");
        formatExpression(node.getCondition(), ctx);
        ctx.append(") ");
        node.getBody().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, TranspilerContext ctx) {
        ctx.append("break;");
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, TranspilerContext ctx) {
        if (node.hasValue()) {
            ctx.append("return ");
            formatExpression(node.getValue(), ctx);
            ctx.append(";");
        } else {
            ctx.append("return;");
        }
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitLiteral(Literal node, TranspilerContext ctx) {
        switch (node.getKind()) {
            case NUMBER:
                ctx.append(JsStringUtils.formatNumber((Double) node.getValue()));
                break;
            case STRING:
                ctx.append(JsStringUtils.quote((String) node.getValue()));
                break;
            default:
                ctx.append(String.valueOf(node.getValue()));
                break;
        }
        return null;
    }

    @Override
    public Void visitVariable(Variable node, TranspilerContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, TranspilerContext ctx) {
        ctx.append(node.getOperator().getSymbol());
        // "- -x" 不能写成 JS 的自减 "--x"
        if (node.getOperator() == UnaryExpr.UnaryOp.NEG && node.getOperand() instanceof UnaryExpr
                && ((UnaryExpr) node.getOperand()).getOperator() == UnaryExpr.UnaryOp.NEG) {
            ctx.append(" ");
        }
        formatExpression(node.getOperand(), ctx);
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, TranspilerContext ctx) {
        formatExpression(node.getLeft(), ctx);
        ctx.append(" ");
        ctx.append(jsOperator(node.getOperator()));
        ctx.append(" ");
        formatExpression(node.getRight(), ctx);
        return null;
    }

    @Override
    public Void visitGroupingExpr(GroupingExpr node, TranspilerContext ctx) {
        ctx.append("(");
        formatExpression(node.getExpression(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitAssignExpr(AssignExpr node, TranspilerContext ctx) {
        ctx.append(node.getName());
        ctx.append(" = ");
        formatExpression(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, TranspilerContext ctx) {
        List<Expression> args = node.getArguments();

        // 内置函数映射
        if (node.isCallTo("clock") && args.isEmpty()) {
            ctx.append("(Date.now() / 1000)");
            return null;
        }
        if (node.isCallTo("len") && args.size() == 1) {
            Expression target = args.get(0);
            boolean simple = target instanceof Variable || target instanceof CallExpr
                    || target instanceof GroupingExpr || target instanceof ListLiteral
                    || (target instanceof Literal && ((Literal) target).getKind() == Literal.LiteralKind.STRING);
            if (!simple) ctx.append("(");
            formatExpression(target, ctx);
            if (!simple) ctx.append(")");
            ctx.append(".length");
            return null;
        }

        if (node.isCallTo("say")) {
            ctx.append("console.log");
        } else {
            formatExpression(node.getCallee(), ctx);
        }
        ctx.append("(");
        formatJoined(args, ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitListLiteral(ListLiteral node, TranspilerContext ctx) {
        ctx.append("[");
        formatJoined(node.getElements(), ctx);
        ctx.append("]");
        return null;
    }

    // ============ 辅助方法 ============

    private void formatExpression(Expression expr, TranspilerContext ctx) {
        expr.accept(this, ctx);
    }

    private void formatJoined(List<Expression> exprs, TranspilerContext ctx) {
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) ctx.append(", ");
            formatExpression(exprs.get(i), ctx);
        }
    }

    private void formatBlock(Block block, TranspilerContext ctx) {
        ctx.append("{");
        if (block.isEmpty()) {
            ctx.append("}");
            return;
        }
        ctx.newLine();
        ctx.indent();
        for (Statement stmt : block.getStatements()) {
            stmt.accept(this, ctx);
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("}");
    }

    /** && 与 || 在 JavaScript 中拼写相同，其余运算符原样输出 */
    private static String jsOperator(BinaryExpr.BinaryOp op) {
        switch (op) {
            case AND: return "&&";
            case OR: return "||";
            default: return op.getSymbol();
        }
    }
}
