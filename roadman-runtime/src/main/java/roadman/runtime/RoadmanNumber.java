package roadman.runtime;

/**
 * 数字（统一为双精度浮点）
 */
public final class RoadmanNumber extends RoadmanValue {

    public static final RoadmanNumber ZERO = new RoadmanNumber(0.0);
    public static final RoadmanNumber ONE = new RoadmanNumber(1.0);

    private final double value;

    private RoadmanNumber(double value) {
        this.value = value;
    }

    public static RoadmanNumber of(double value) {
        if (value == 0.0 && Double.doubleToRawLongBits(value) == 0L) return ZERO;
        if (value == 1.0) return ONE;
        return new RoadmanNumber(value);
    }

    public double getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Number";
    }

    @Override
    public boolean isTruthy() {
        return value != 0.0;
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoadmanNumber)) return false;
        return value == ((RoadmanNumber) o).value;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value == 0.0 ? 0.0 : value);
    }

    /** 总带小数部分：120.0、22.5 */
    @Override
    public String toString() {
        return Double.toString(value);
    }
}
