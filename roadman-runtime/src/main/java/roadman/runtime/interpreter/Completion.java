package roadman.runtime.interpreter;

import roadman.runtime.RoadmanNull;
import roadman.runtime.RoadmanValue;

/**
 * 语句执行结果：正常结束、returnz 或 stopit
 *
 * <p>代码块遇到非正常结果立即停止并向上传递；loopz 消费 BREAK，函数调用消费 RETURN。</p>
 */
public final class Completion {

    /**
     * 完成类型
     */
    public enum Kind {
        NORMAL,
        RETURN,
        BREAK
    }

    public static final Completion NORMAL = new Completion(Kind.NORMAL, RoadmanNull.NULL);
    public static final Completion BREAK = new Completion(Kind.BREAK, RoadmanNull.NULL);

    private final Kind kind;
    private final RoadmanValue value;

    private Completion(Kind kind, RoadmanValue value) {
        this.kind = kind;
        this.value = value;
    }

    public static Completion returning(RoadmanValue value) {
        return new Completion(Kind.RETURN, value);
    }

    public Kind getKind() {
        return kind;
    }

    /** RETURN 携带的值，其余为 null 值 */
    public RoadmanValue getValue() {
        return value;
    }

    public boolean isNormal() {
        return kind == Kind.NORMAL;
    }

    public boolean isReturn() {
        return kind == Kind.RETURN;
    }

    public boolean isBreak() {
        return kind == Kind.BREAK;
    }

    @Override
    public String toString() {
        return kind == Kind.RETURN ? "RETURN(" + value + ")" : kind.name();
    }
}
