package roadman.runtime;

/**
 * 字符串
 */
public final class RoadmanString extends RoadmanValue {

    public static final RoadmanString EMPTY = new RoadmanString("");

    private final String value;

    private RoadmanString(String value) {
        this.value = value;
    }

    public static RoadmanString of(String value) {
        if (value.isEmpty()) return EMPTY;
        return new RoadmanString(value);
    }

    public String getValue() {
        return value;
    }

    public int length() {
        return value.length();
    }

    @Override
    public String getTypeName() {
        return "String";
    }

    @Override
    public boolean isTruthy() {
        return !value.isEmpty();
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoadmanString)) return false;
        return value.equals(((RoadmanString) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    /** 显示时不带引号 */
    @Override
    public String toString() {
        return value;
    }
}
