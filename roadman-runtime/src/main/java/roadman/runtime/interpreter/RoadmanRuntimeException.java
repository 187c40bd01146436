package roadman.runtime.interpreter;

import com.roadmanlang.compiler.ast.SourceLocation;

/**
 * Roadman 运行时异常
 *
 * <p>位置由最内层出错的表达式附加，外层不会覆盖。</p>
 */
public class RoadmanRuntimeException extends RuntimeException {

    private SourceLocation location;

    public RoadmanRuntimeException(String message) {
        super(message);
    }

    public RoadmanRuntimeException(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public boolean hasLocation() {
        return location != null && location.getLine() > 0;
    }

    /** 尚无位置时附加位置 */
    void attachLocation(SourceLocation location) {
        if (this.location == null) {
            this.location = location;
        }
    }

    /**
     * 面向用户的错误文本：{@code [line L:C] Runtime error: message}
     */
    public String format() {
        if (hasLocation()) {
            return "[line " + location.getLine() + ":" + location.getColumn() + "] Runtime error: " + getMessage();
        }
        return "Runtime error: " + getMessage();
    }
}
