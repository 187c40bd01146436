package roadman.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 列表（创建后不可变）
 */
public final class RoadmanList extends RoadmanValue {

    private final List<RoadmanValue> elements;

    public RoadmanList(List<RoadmanValue> elements) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public List<RoadmanValue> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public RoadmanValue get(int index) {
        return elements.get(index);
    }

    @Override
    public String getTypeName() {
        return "List";
    }

    @Override
    public Object toJavaValue() {
        List<Object> result = new ArrayList<>(elements.size());
        for (RoadmanValue element : elements) {
            result.add(element.toJavaValue());
        }
        return result;
    }

    /** 逐元素比较 */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoadmanList)) return false;
        return elements.equals(((RoadmanList) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i));
        }
        return sb.append("]").toString();
    }
}
