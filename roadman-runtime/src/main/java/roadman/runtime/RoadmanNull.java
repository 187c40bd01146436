package roadman.runtime;

/**
 * 空值：无初始值的变量、无返回值的函数调用
 */
public final class RoadmanNull extends RoadmanValue {

    public static final RoadmanNull NULL = new RoadmanNull();

    private RoadmanNull() {
    }

    @Override
    public String getTypeName() {
        return "Null";
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public boolean isNull() {
        return true;
    }

    @Override
    public Object toJavaValue() {
        return null;
    }

    @Override
    public String toString() {
        return "null";
    }
}
