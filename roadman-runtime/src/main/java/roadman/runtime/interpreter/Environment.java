package roadman.runtime.interpreter;

import roadman.runtime.RoadmanValue;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 运行时环境（作用域）
 *
 * <p>管理变量绑定，支持嵌套作用域。进入代码块和调用函数时创建；
 * 被闭包捕获的环境随闭包一起存活。</p>
 */
public final class Environment {

    private final Environment parent;
    private final Map<String, RoadmanValue> values = new LinkedHashMap<>();
    private final Set<String> constants = new HashSet<>();

    /**
     * 创建全局环境
     */
    public Environment() {
        this.parent = null;
    }

    /**
     * 创建子环境
     */
    public Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment getParent() {
        return parent;
    }

    /**
     * 在当前作用域定义变量。同名变量直接替换（含常量标记）。
     */
    public void define(String name, RoadmanValue value, boolean isConstant) {
        values.put(name, value);
        if (isConstant) {
            constants.add(name);
        } else {
            constants.remove(name);
        }
    }

    /**
     * 定义可变变量（gimme）
     */
    public void defineVar(String name, RoadmanValue value) {
        define(name, value, false);
    }

    /**
     * 定义常量（conste）
     */
    public void defineConst(String name, RoadmanValue value) {
        define(name, value, true);
    }

    /**
     * 获取变量值，沿父环境链查找
     */
    public RoadmanValue get(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            RoadmanValue value = env.values.get(name);
            if (value != null) return value;
        }
        throw new RoadmanRuntimeException("Undefined variable '" + name + "'.");
    }

    /**
     * 尝试获取变量值（不抛异常）
     */
    public RoadmanValue tryGet(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            RoadmanValue value = env.values.get(name);
            if (value != null) return value;
        }
        return null;
    }

    /**
     * 赋值给最近一层已定义的同名变量
     */
    public void assign(String name, RoadmanValue value) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.values.containsKey(name)) {
                if (env.constants.contains(name)) {
                    throw new RoadmanRuntimeException("Cannot assign to constant '" + name + "'.");
                }
                env.values.put(name, value);
                return;
            }
        }
        throw new RoadmanRuntimeException("Undefined variable '" + name + "'.");
    }

    /**
     * 检查变量是否存在（含父环境）
     */
    public boolean contains(String name) {
        return tryGet(name) != null;
    }

    /**
     * 检查变量是否在当前作用域定义
     */
    public boolean containsLocal(String name) {
        return values.containsKey(name);
    }

    public boolean isConstant(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.values.containsKey(name)) {
                return env.constants.contains(name);
            }
        }
        throw new RoadmanRuntimeException("Undefined variable '" + name + "'.");
    }

    /**
     * 当前作用域的绑定（按定义顺序，只读）
     */
    public Map<String, RoadmanValue> getLocalBindings() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Environment{\n");
        for (Map.Entry<String, RoadmanValue> entry : values.entrySet()) {
            String kind = constants.contains(entry.getKey()) ? "conste" : "gimme";
            sb.append("  ").append(kind).append(" ")
              .append(entry.getKey()).append(" = ")
              .append(entry.getValue()).append("\n");
        }
        sb.append("}");
        if (parent != null) {
            sb.append(" -> parent");
        }
        return sb.toString();
    }
}
