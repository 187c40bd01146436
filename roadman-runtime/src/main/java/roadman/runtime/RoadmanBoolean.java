package roadman.runtime;

/**
 * 布尔值
 */
public final class RoadmanBoolean extends RoadmanValue {

    public static final RoadmanBoolean TRUE = new RoadmanBoolean(true);
    public static final RoadmanBoolean FALSE = new RoadmanBoolean(false);

    private final boolean value;

    private RoadmanBoolean(boolean value) {
        this.value = value;
    }

    public static RoadmanBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Boolean";
    }

    @Override
    public boolean isTruthy() {
        return value;
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public String toString() {
        return value ? "true" : "false";
    }
}
