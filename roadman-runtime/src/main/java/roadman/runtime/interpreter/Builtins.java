package roadman.runtime.interpreter;

import roadman.runtime.RoadmanList;
import roadman.runtime.RoadmanNull;
import roadman.runtime.RoadmanNumber;
import roadman.runtime.RoadmanString;
import roadman.runtime.RoadmanValue;

/**
 * 内置函数注册：say、clock、len
 */
final class Builtins {

    private Builtins() {
    }

    static void register(Environment globals) {
        // say(value)：输出值的显示形式并换行
        globals.defineVar("say", new RoadmanNativeFunction("say", 1, (interp, args) -> {
            interp.getOut().println(args.get(0));
            return RoadmanNull.NULL;
        }));

        // clock()：自 epoch 起的秒数
        globals.defineVar("clock", new RoadmanNativeFunction("clock", 0,
                (interp, args) -> RoadmanNumber.of(System.currentTimeMillis() / 1000.0)));

        // len(value)：列表或字符串长度
        globals.defineVar("len", new RoadmanNativeFunction("len", 1, (interp, args) -> {
            RoadmanValue target = args.get(0);
            if (target instanceof RoadmanList) {
                return RoadmanNumber.of(((RoadmanList) target).size());
            }
            if (target instanceof RoadmanString) {
                return RoadmanNumber.of(((RoadmanString) target).length());
            }
            throw new RoadmanRuntimeException("len() expects a list or a string but got " + target.getTypeName() + ".");
        }));
    }
}
