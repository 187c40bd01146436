package roadman.runtime.interpreter;

import com.roadmanlang.compiler.ast.ExpressionVisitor;
import com.roadmanlang.compiler.ast.StatementVisitor;
import com.roadmanlang.compiler.ast.decl.FunDecl;
import com.roadmanlang.compiler.ast.decl.Program;
import com.roadmanlang.compiler.ast.decl.VarDecl;
import com.roadmanlang.compiler.ast.expr.*;
import com.roadmanlang.compiler.ast.stmt.*;
import roadman.runtime.RoadmanBoolean;
import roadman.runtime.RoadmanList;
import roadman.runtime.RoadmanNull;
import roadman.runtime.RoadmanNumber;
import roadman.runtime.RoadmanString;
import roadman.runtime.RoadmanValue;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Roadman 树遍历解释器
 *
 * <p>表达式求值返回 {@link RoadmanValue}，语句执行返回 {@link Completion}；
 * 当前环境作为访问者上下文向下传递。单线程使用，一个实例对应一个全局环境。</p>
 */
public class Interpreter implements ExpressionVisitor<RoadmanValue, Environment>,
        StatementVisitor<Completion, Environment> {

    private static final Logger LOG = Logger.getLogger(Interpreter.class.getName());

    public static final int DEFAULT_MAX_CALL_DEPTH = 1000;

    private final Environment globals = new Environment();
    private final PrintStream out;
    private final PrintStream err;
    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
    private int callDepth = 0;

    public Interpreter() {
        this(System.out, System.err);
    }

    public Interpreter(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
        Builtins.register(globals);
    }

    public Environment getGlobals() {
        return globals;
    }

    public PrintStream getOut() {
        return out;
    }

    public int getMaxCallDepth() {
        return maxCallDepth;
    }

    public void setMaxCallDepth(int maxCallDepth) {
        if (maxCallDepth <= 0) {
            throw new IllegalArgumentException("maxCallDepth must be positive: " + maxCallDepth);
        }
        this.maxCallDepth = maxCallDepth;
    }

    // ============ 入口 ============

    /**
     * 按顺序执行程序语句。运行时错误会中止本程序的剩余语句，
     * 报告到错误流并返回 false，不会向外抛出。
     */
    public boolean interpret(Program program) {
        try {
            execute(program);
            return true;
        } catch (RoadmanRuntimeException e) {
            reportRuntimeError(e);
            return false;
        }
    }

    /**
     * 执行程序，运行时错误向外抛出
     */
    public void execute(Program program) {
        callDepth = 0;
        try {
            for (Statement stmt : program.getStatements()) {
                Completion completion = execute(stmt, globals);
                if (completion.isReturn()) {
                    LOG.fine("Top-level returnz ends the program");
                    return;
                }
            }
        } catch (StackOverflowError e) {
            throw new RoadmanRuntimeException("Stack overflow.");
        }
    }

    private void reportRuntimeError(RoadmanRuntimeException e) {
        LOG.log(Level.FINE, "Runtime error", e);
        err.println(e.format());
    }

    // ============ 执行辅助 ============

    Completion execute(Statement stmt, Environment env) {
        return stmt.accept(this, env);
    }

    /**
     * 在给定环境中顺序执行语句，遇到非正常结果立即返回
     */
    Completion executeBlock(List<Statement> statements, Environment env) {
        for (Statement stmt : statements) {
            Completion completion = execute(stmt, env);
            if (!completion.isNormal()) {
                return completion;
            }
        }
        return Completion.NORMAL;
    }

    /**
     * 求值表达式，为尚无位置的运行时错误附加当前表达式的位置
     */
    RoadmanValue evaluate(Expression expr, Environment env) {
        try {
            return expr.accept(this, env);
        } catch (RoadmanRuntimeException e) {
            e.attachLocation(expr.getLocation());
            throw e;
        }
    }

    /**
     * 调用可调用对象（检查参数个数与调用深度）
     */
    public RoadmanValue call(RoadmanCallable callee, List<RoadmanValue> args) {
        int arity = callee.getArity();
        if (arity >= 0 && arity != args.size()) {
            throw new RoadmanRuntimeException("Expected " + arity + " arguments but got " + args.size() + ".");
        }
        if (callDepth >= maxCallDepth) {
            throw new RoadmanRuntimeException("Maximum recursion depth exceeded (" + maxCallDepth + ")");
        }
        callDepth++;
        try {
            return callee.call(this, args);
        } finally {
            callDepth--;
        }
    }

    // ============ 声明 ============

    @Override
    public Completion visitVarDecl(VarDecl node, Environment env) {
        RoadmanValue value = RoadmanNull.NULL;
        if (node.hasInitializer()) {
            value = evaluate(node.getInitializer(), env);
        }
        env.define(node.getName(), value, node.isConstant());
        return Completion.NORMAL;
    }

    @Override
    public Completion visitFunDecl(FunDecl node, Environment env) {
        // 先定义再捕获同一环境，递归调用可见自身
        env.define(node.getName(), new RoadmanFunction(node, env), false);
        return Completion.NORMAL;
    }

    // ============ 语句 ============

    @Override
    public Completion visitExpressionStmt(ExpressionStmt node, Environment env) {
        evaluate(node.getExpression(), env);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitBlock(Block node, Environment env) {
        return executeBlock(node.getStatements(), new Environment(env));
    }

    @Override
    public Completion visitIfStmt(IfStmt node, Environment env) {
        if (evaluate(node.getCondition(), env).isTruthy()) {
            return execute(node.getThenBranch(), env);
        }
        if (node.hasElse()) {
            return execute(node.getElseBranch(), env);
        }
        return Completion.NORMAL;
    }

    @Override
    public Completion visitWhileStmt(WhileStmt node, Environment env) {
        while (evaluate(node.getCondition(), env).isTruthy()) {
            Completion completion = execute(node.getBody(), env);
            if (completion.isBreak()) {
                break;
            }
            if (completion.isReturn()) {
                return completion;
            }
        }
        return Completion.NORMAL;
    }

    @Override
    public Completion visitBreakStmt(BreakStmt node, Environment env) {
        return Completion.BREAK;
    }

    @Override
    public Completion visitReturnStmt(ReturnStmt node, Environment env) {
        RoadmanValue value = RoadmanNull.NULL;
        if (node.hasValue()) {
            value = evaluate(node.getValue(), env);
        }
        return Completion.returning(value);
    }

    // ============ 表达式 ============

    @Override
    public RoadmanValue visitLiteral(Literal node, Environment env) {
        switch (node.getKind()) {
            case NUMBER:
                return RoadmanNumber.of((Double) node.getValue());
            case STRING:
                return RoadmanString.of((String) node.getValue());
            default:
                return RoadmanBoolean.of((Boolean) node.getValue());
        }
    }

    @Override
    public RoadmanValue visitVariable(Variable node, Environment env) {
        return env.get(node.getName());
    }

    @Override
    public RoadmanValue visitUnaryExpr(UnaryExpr node, Environment env) {
        RoadmanValue operand = evaluate(node.getOperand(), env);
        if (node.getOperator() == UnaryExpr.UnaryOp.NOT) {
            return RoadmanBoolean.of(!operand.isTruthy());
        }
        if (!(operand instanceof RoadmanNumber)) {
            throw new RoadmanRuntimeException("Operator '-': Operand must be a number.");
        }
        return RoadmanNumber.of(-((RoadmanNumber) operand).getValue());
    }

    @Override
    public RoadmanValue visitBinaryExpr(BinaryExpr node, Environment env) {
        RoadmanValue left = evaluate(node.getLeft(), env);

        // 短路：返回决定结果的操作数本身
        switch (node.getOperator()) {
            case AND:
                return left.isTruthy() ? evaluate(node.getRight(), env) : left;
            case OR:
                return left.isTruthy() ? left : evaluate(node.getRight(), env);
            default:
                break;
        }

        RoadmanValue right = evaluate(node.getRight(), env);
        return BinaryOps.apply(node.getOperator(), left, right);
    }

    @Override
    public RoadmanValue visitGroupingExpr(GroupingExpr node, Environment env) {
        return evaluate(node.getExpression(), env);
    }

    @Override
    public RoadmanValue visitAssignExpr(AssignExpr node, Environment env) {
        RoadmanValue value = evaluate(node.getValue(), env);
        env.assign(node.getName(), value);
        return value;
    }

    @Override
    public RoadmanValue visitCallExpr(CallExpr node, Environment env) {
        RoadmanValue callee = evaluate(node.getCallee(), env);

        List<RoadmanValue> args = new ArrayList<>(node.getArguments().size());
        for (Expression arg : node.getArguments()) {
            args.add(evaluate(arg, env));
        }

        if (!(callee instanceof RoadmanCallable)) {
            throw new RoadmanRuntimeException("Can only call functions.");
        }
        return call((RoadmanCallable) callee, args);
    }

    @Override
    public RoadmanValue visitListLiteral(ListLiteral node, Environment env) {
        List<RoadmanValue> elements = new ArrayList<>(node.getElements().size());
        for (Expression element : node.getElements()) {
            elements.add(evaluate(element, env));
        }
        return new RoadmanList(elements);
    }
}
