package roadman.runtime.interpreter;

import roadman.runtime.RoadmanValue;

import java.util.List;

/**
 * 原生（Java）函数
 */
public final class RoadmanNativeFunction extends RoadmanValue implements RoadmanCallable {

    /**
     * 原生函数接口
     */
    @FunctionalInterface
    public interface NativeFunc {
        RoadmanValue apply(Interpreter interpreter, List<RoadmanValue> args);
    }

    private final String name;
    private final int arity;
    private final NativeFunc function;

    public RoadmanNativeFunction(String name, int arity, NativeFunc function) {
        this.name = name;
        this.arity = arity;
        this.function = function;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getArity() {
        return arity;
    }

    @Override
    public RoadmanValue call(Interpreter interpreter, List<RoadmanValue> args) {
        return function.apply(interpreter, args);
    }

    @Override
    public String getTypeName() {
        return "NativeFunction";
    }

    @Override
    public Object toJavaValue() {
        return this;
    }

    @Override
    public String toString() {
        return "<native fn " + name + ">";
    }
}
