package roadman.runtime.interpreter;

import com.roadmanlang.compiler.ast.decl.FunDecl;
import roadman.runtime.RoadmanNull;
import roadman.runtime.RoadmanValue;

import java.util.List;

/**
 * 用户定义的函数（闭包）
 *
 * <p>持有声明节点和声明处的环境。环境通过普通引用共享，
 * 只要还有闭包或调用帧可达就不会被回收。</p>
 */
public final class RoadmanFunction extends RoadmanValue implements RoadmanCallable {

    private final FunDecl declaration;
    private final Environment closure;

    public RoadmanFunction(FunDecl declaration, Environment closure) {
        this.declaration = declaration;
        this.closure = closure;
    }

    @Override
    public String getName() {
        return declaration.getName();
    }

    @Override
    public int getArity() {
        return declaration.getArity();
    }

    @Override
    public RoadmanValue call(Interpreter interpreter, List<RoadmanValue> args) {
        // 新环境的父环境是闭包，而不是调用者的环境
        Environment env = new Environment(closure);
        List<String> params = declaration.getParams();
        for (int i = 0; i < params.size(); i++) {
            env.define(params.get(i), args.get(i), false);
        }

        Completion completion = interpreter.executeBlock(declaration.getBody().getStatements(), env);
        if (completion.isReturn()) {
            return completion.getValue();
        }
        return RoadmanNull.NULL;
    }

    @Override
    public String getTypeName() {
        return "Function";
    }

    @Override
    public Object toJavaValue() {
        return this;
    }

    @Override
    public String toString() {
        return "<fn " + getName() + ">";
    }
}
