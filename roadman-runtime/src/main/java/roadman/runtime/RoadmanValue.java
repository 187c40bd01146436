package roadman.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * Roadman 运行时值的基类
 *
 * <p>值的种类是封闭的：数字、字符串、布尔、列表、可调用对象和空值。
 * 子类的 {@link #toString()} 即语言内的显示形式。</p>
 */
public abstract class RoadmanValue {

    /**
     * 获取类型名称（用于错误信息）
     */
    public abstract String getTypeName();

    /**
     * 真值判断：null 为假，数字 0 与空字符串为假，其余为真
     */
    public boolean isTruthy() {
        return true;
    }

    public boolean isNull() {
        return false;
    }

    /**
     * 转换为 Java 值
     */
    public abstract Object toJavaValue();

    /**
     * 将 Java 值转换为 RoadmanValue
     */
    public static RoadmanValue fromJava(Object javaValue) {
        if (javaValue == null) {
            return RoadmanNull.NULL;
        }
        if (javaValue instanceof RoadmanValue) {
            return (RoadmanValue) javaValue;
        }
        if (javaValue instanceof Number) {
            return RoadmanNumber.of(((Number) javaValue).doubleValue());
        }
        if (javaValue instanceof Boolean) {
            return RoadmanBoolean.of((Boolean) javaValue);
        }
        if (javaValue instanceof CharSequence) {
            return RoadmanString.of(javaValue.toString());
        }
        if (javaValue instanceof Iterable) {
            List<RoadmanValue> elements = new ArrayList<>();
            for (Object item : (Iterable<?>) javaValue) {
                elements.add(fromJava(item));
            }
            return new RoadmanList(elements);
        }
        throw new IllegalArgumentException("Cannot convert to Roadman value: " + javaValue.getClass().getName());
    }
}
