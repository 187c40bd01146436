package roadman.runtime;

import java.util.Collections;
import java.util.List;

/**
 * 一次执行的结果
 */
public final class RunResult {

    /**
     * 执行状态
     */
    public enum Status {
        SUCCESS,
        SYNTAX_ERROR,
        RUNTIME_ERROR
    }

    private static final RunResult SUCCESS = new RunResult(Status.SUCCESS, Collections.<String>emptyList());

    private final Status status;
    private final List<String> errors;

    private RunResult(Status status, List<String> errors) {
        this.status = status;
        this.errors = Collections.unmodifiableList(errors);
    }

    public static RunResult success() {
        return SUCCESS;
    }

    public static RunResult syntaxError(List<String> errors) {
        return new RunResult(Status.SYNTAX_ERROR, errors);
    }

    public static RunResult runtimeError(String error) {
        return new RunResult(Status.RUNTIME_ERROR, Collections.singletonList(error));
    }

    public Status getStatus() {
        return status;
    }

    /** 已报告的错误文本，与输出到错误流的内容一致 */
    public List<String> getErrors() {
        return errors;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    @Override
    public String toString() {
        return status + (errors.isEmpty() ? "" : " " + errors);
    }
}
