package roadman.runtime.interpreter;

import roadman.runtime.RoadmanValue;

import java.util.List;

/**
 * 可调用对象接口
 */
public interface RoadmanCallable {

    String getName();

    /**
     * 参数个数，-1 表示可变参数
     */
    int getArity();

    /**
     * 调用。参数个数已由解释器检查。
     */
    RoadmanValue call(Interpreter interpreter, List<RoadmanValue> args);
}
