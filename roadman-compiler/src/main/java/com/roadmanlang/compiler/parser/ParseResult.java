package com.roadmanlang.compiler.parser;

import com.roadmanlang.compiler.ast.decl.Program;

import java.util.Collections;
import java.util.List;

/**
 * 容错解析的结果：包含部分 AST 和收集到的错误列表
 */
public final class ParseResult {
    private final Program program;
    private final List<ParseError> errors;

    public ParseResult(Program program, List<ParseError> errors) {
        this.program = program;
        this.errors = Collections.unmodifiableList(errors);
    }

    public Program getProgram() {
        return program;
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
