package roadman.runtime.interpreter;

import com.roadmanlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import roadman.runtime.RoadmanBoolean;
import roadman.runtime.RoadmanNumber;
import roadman.runtime.RoadmanString;
import roadman.runtime.RoadmanValue;

/**
 * 二元运算实现（不含短路的 &amp;&amp; / ||）
 */
final class BinaryOps {

    private BinaryOps() {
    }

    static RoadmanValue apply(BinaryOp op, RoadmanValue left, RoadmanValue right) {
        switch (op) {
            case ADD:
                return add(left, right);
            case SUB:
            case MUL:
            case DIV:
            case MOD:
                return arithmetic(op, left, right);
            case EQ:
                return RoadmanBoolean.of(isEqual(left, right));
            case NE:
                return RoadmanBoolean.of(!isEqual(left, right));
            case LT:
            case LE:
            case GT:
            case GE:
                return RoadmanBoolean.of(compare(op, left, right));
            default:
                throw new IllegalStateException("Short-circuit operator reached BinaryOps: " + op);
        }
    }

    /**
     * 相等：null 只等于 null，不同种类的值永不相等，列表逐元素比较，函数按引用
     */
    static boolean isEqual(RoadmanValue left, RoadmanValue right) {
        if (left.isNull() && right.isNull()) return true;
        if (left.isNull() || right.isNull()) return false;
        return left.equals(right);
    }

    private static RoadmanValue add(RoadmanValue left, RoadmanValue right) {
        if (left instanceof RoadmanNumber && right instanceof RoadmanNumber) {
            return RoadmanNumber.of(((RoadmanNumber) left).getValue() + ((RoadmanNumber) right).getValue());
        }
        if (left instanceof RoadmanString && right instanceof RoadmanString) {
            return RoadmanString.of(((RoadmanString) left).getValue() + ((RoadmanString) right).getValue());
        }
        throw new RoadmanRuntimeException("Operator '+': Operands must be two numbers or two strings.");
    }

    private static RoadmanValue arithmetic(BinaryOp op, RoadmanValue left, RoadmanValue right) {
        if (!(left instanceof RoadmanNumber) || !(right instanceof RoadmanNumber)) {
            throw new RoadmanRuntimeException("Operator '" + op.getSymbol() + "': Operands must be numbers.");
        }
        double a = ((RoadmanNumber) left).getValue();
        double b = ((RoadmanNumber) right).getValue();
        switch (op) {
            case SUB:
                return RoadmanNumber.of(a - b);
            case MUL:
                return RoadmanNumber.of(a * b);
            case DIV:
                if (b == 0.0) throw new RoadmanRuntimeException("Division by zero.");
                return RoadmanNumber.of(a / b);
            default:
                // Java 的 % 截断取余，符号随被除数，与 JavaScript 一致
                if (b == 0.0) throw new RoadmanRuntimeException("Division by zero.");
                return RoadmanNumber.of(a % b);
        }
    }

    private static boolean compare(BinaryOp op, RoadmanValue left, RoadmanValue right) {
        int cmp;
        if (left instanceof RoadmanNumber && right instanceof RoadmanNumber) {
            double a = ((RoadmanNumber) left).getValue();
            double b = ((RoadmanNumber) right).getValue();
            switch (op) {
                case LT: return a < b;
                case LE: return a <= b;
                case GT: return a > b;
                default: return a >= b;
            }
        } else if (left instanceof RoadmanString && right instanceof RoadmanString) {
            cmp = ((RoadmanString) left).getValue().compareTo(((RoadmanString) right).getValue());
        } else {
            throw new RoadmanRuntimeException("Operator '" + op.getSymbol()
                    + "': Operands must be two numbers or two strings.");
        }
        switch (op) {
            case LT: return cmp < 0;
            case LE: return cmp <= 0;
            case GT: return cmp > 0;
            default: return cmp >= 0;
        }
    }
}
