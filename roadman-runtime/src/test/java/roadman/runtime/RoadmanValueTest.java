package roadman.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 运行时值测试
 */
class RoadmanValueTest {

    @Test
    @DisplayName("数字总是以浮点形式显示")
    void testNumberRendering() {
        assertEquals("120.0", RoadmanNumber.of(120).toString());
        assertEquals("22.5", RoadmanNumber.of(22.5).toString());
        assertEquals("-0.5", RoadmanNumber.of(-0.5).toString());
    }

    @Test
    @DisplayName("真值")
    void testTruthiness() {
        assertFalse(RoadmanNull.NULL.isTruthy());
        assertFalse(RoadmanBoolean.FALSE.isTruthy());
        assertFalse(RoadmanNumber.of(0).isTruthy());
        assertFalse(RoadmanString.of("").isTruthy());

        assertTrue(RoadmanBoolean.TRUE.isTruthy());
        assertTrue(RoadmanNumber.of(-1).isTruthy());
        assertTrue(RoadmanString.of("0").isTruthy());
        assertTrue(new RoadmanList(Collections.<RoadmanValue>emptyList()).isTruthy());
    }

    @Test
    @DisplayName("列表逐元素相等并嵌套显示")
    void testList() {
        RoadmanList a = new RoadmanList(Arrays.<RoadmanValue>asList(
                RoadmanNumber.of(1), RoadmanString.of("two"), RoadmanBoolean.TRUE));
        RoadmanList b = new RoadmanList(Arrays.<RoadmanValue>asList(
                RoadmanNumber.of(1.0), RoadmanString.of("two"), RoadmanBoolean.TRUE));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(3, a.size());
        assertEquals("[1.0, two, true]", a.toString());

        RoadmanList nested = new RoadmanList(Arrays.<RoadmanValue>asList(a, RoadmanNull.NULL));
        assertEquals("[[1.0, two, true], null]", nested.toString());
    }

    @Test
    @DisplayName("Java 值转换")
    void testFromJava() {
        assertSame(RoadmanNull.NULL, RoadmanValue.fromJava(null));
        assertEquals(RoadmanNumber.of(3), RoadmanValue.fromJava(3));
        assertEquals(RoadmanString.of("hi"), RoadmanValue.fromJava("hi"));
        assertSame(RoadmanBoolean.TRUE, RoadmanValue.fromJava(true));
        assertEquals("[1.0, x]", RoadmanValue.fromJava(Arrays.asList(1, "x")).toString());
        assertThrows(IllegalArgumentException.class, () -> RoadmanValue.fromJava(new Object()));
    }

    @Test
    @DisplayName("类型名")
    void testTypeNames() {
        assertEquals("Null", RoadmanNull.NULL.getTypeName());
        assertEquals("Number", RoadmanNumber.of(1).getTypeName());
        assertEquals("String", RoadmanString.of("s").getTypeName());
        assertEquals("Boolean", RoadmanBoolean.TRUE.getTypeName());
    }
}
