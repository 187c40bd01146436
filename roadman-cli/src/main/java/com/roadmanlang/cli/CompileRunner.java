package com.roadmanlang.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.roadmanlang.compiler.ast.decl.Program;
import com.roadmanlang.compiler.lexer.LexDiagnostic;
import com.roadmanlang.compiler.lexer.LexResult;
import com.roadmanlang.compiler.lexer.Lexer;
import com.roadmanlang.compiler.lexer.Token;
import com.roadmanlang.compiler.parser.ParseError;
import com.roadmanlang.compiler.parser.ParseException;
import com.roadmanlang.compiler.parser.ParseResult;
import com.roadmanlang.compiler.parser.Parser;
import com.roadmanlang.compiler.transpiler.JsTranspiler;
import com.roadmanlang.compiler.transpiler.TranspileConfig;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 不执行源码的处理：转译、Token 输出、语法检查
 */
public class CompileRunner {

    private static final Logger LOG = Logger.getLogger(CompileRunner.class.getName());

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private final PrintStream out;
    private final PrintStream err;

    public CompileRunner(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 转译为 JavaScript，outputPath 为 null 时打印到标准输出
     */
    public int transpileFile(String filePath, String outputPath, TranspileConfig config) {
        String source = ScriptRunner.readSource(filePath, err);
        if (source == null) {
            return Main.EXIT_IO_ERROR;
        }

        LexResult lexed = new Lexer(source).tokenize();
        if (lexed.hasErrors()) {
            for (LexDiagnostic diagnostic : lexed.getDiagnostics()) {
                err.println(diagnostic);
            }
            return Main.EXIT_SYNTAX_ERROR;
        }

        Program program;
        try {
            program = new Parser(lexed.getTokens(), filePath).parse();
        } catch (ParseException e) {
            LOG.log(Level.FINE, "Parse failed: " + filePath, e);
            err.println(e.getMessage());
            return Main.EXIT_SYNTAX_ERROR;
        }

        String js;
        try {
            js = new JsTranspiler().transpile(program, config);
        } catch (StackOverflowError e) {
            err.println("错误: 表达式嵌套过深，无法转译 - " + filePath);
            return Main.EXIT_SYNTAX_ERROR;
        }
        if (outputPath == null) {
            out.println(js);
            return Main.EXIT_OK;
        }

        Path target = Paths.get(outputPath);
        try {
            Path dir = target.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Files.write(target, (js + "\n").getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOG.log(Level.FINE, "Write failed: " + outputPath, e);
            err.println("错误: 无法写入文件 - " + outputPath + " (" + e.getMessage() + ")");
            return Main.EXIT_IO_ERROR;
        }
        LOG.fine(() -> "Transpiled " + filePath + " -> " + outputPath);
        return Main.EXIT_OK;
    }

    /**
     * 输出 Token 序列，存在词法诊断时返回语法错误退出码
     */
    public int dumpTokens(String filePath, boolean json) {
        String source = ScriptRunner.readSource(filePath, err);
        if (source == null) {
            return Main.EXIT_IO_ERROR;
        }

        LexResult lexed = new Lexer(source).tokenize();
        if (json) {
            JsonObject root = new JsonObject();
            root.addProperty("file", filePath);
            JsonArray tokens = new JsonArray();
            for (Token token : lexed.getTokens()) {
                tokens.add(tokenToJson(token));
            }
            root.add("tokens", tokens);
            root.add("diagnostics", lexDiagnosticsToJson(lexed));
            out.println(GSON.toJson(root));
        } else {
            for (Token token : lexed.getTokens()) {
                out.println(formatToken(token));
            }
            for (LexDiagnostic diagnostic : lexed.getDiagnostics()) {
                err.println(diagnostic);
            }
        }
        return lexed.hasErrors() ? Main.EXIT_SYNTAX_ERROR : Main.EXIT_OK;
    }

    /**
     * 容错解析并列出全部错误
     */
    public int checkFile(String filePath, boolean json) {
        String source = ScriptRunner.readSource(filePath, err);
        if (source == null) {
            return Main.EXIT_IO_ERROR;
        }

        LexResult lexed = new Lexer(source).tokenize();
        ParseResult parsed = new Parser(lexed.getTokens(), filePath).parseTolerant();
        int errorCount = lexed.getDiagnostics().size() + parsed.getErrors().size();

        if (json) {
            JsonObject root = new JsonObject();
            root.addProperty("file", filePath);
            root.addProperty("ok", errorCount == 0);
            root.add("lexErrors", lexDiagnosticsToJson(lexed));
            JsonArray parseErrors = new JsonArray();
            for (ParseError error : parsed.getErrors()) {
                JsonObject obj = new JsonObject();
                obj.addProperty("message", error.getMessage());
                obj.addProperty("line", error.getLine());
                obj.addProperty("column", error.getColumn());
                parseErrors.add(obj);
            }
            root.add("parseErrors", parseErrors);
            out.println(GSON.toJson(root));
        } else {
            for (LexDiagnostic diagnostic : lexed.getDiagnostics()) {
                out.println(diagnostic);
            }
            for (ParseError error : parsed.getErrors()) {
                out.println(error.getMessage());
            }
            if (errorCount == 0) {
                out.println(filePath + ": OK");
            } else {
                out.println(filePath + ": " + errorCount + " error(s)");
            }
        }
        return errorCount == 0 ? Main.EXIT_OK : Main.EXIT_SYNTAX_ERROR;
    }

    static String formatToken(Token token) {
        StringBuilder sb = new StringBuilder();
        sb.append(token.getLine()).append(':').append(token.getColumn())
          .append('\t').append(token.getType());
        if (!token.getLexeme().isEmpty()) {
            sb.append('\t').append(token.getLexeme());
        }
        return sb.toString();
    }

    private static JsonObject tokenToJson(Token token) {
        JsonObject obj = new JsonObject();
        obj.addProperty("type", token.getType().name());
        obj.addProperty("lexeme", token.getLexeme());
        obj.addProperty("line", token.getLine());
        obj.addProperty("column", token.getColumn());
        Object literal = token.getLiteral();
        if (literal instanceof Number) {
            obj.addProperty("literal", (Number) literal);
        } else if (literal != null) {
            obj.addProperty("literal", literal.toString());
        }
        return obj;
    }

    private static JsonArray lexDiagnosticsToJson(LexResult lexed) {
        JsonArray array = new JsonArray();
        for (LexDiagnostic diagnostic : lexed.getDiagnostics()) {
            JsonObject obj = new JsonObject();
            obj.addProperty("message", diagnostic.getMessage());
            obj.addProperty("line", diagnostic.getLine());
            obj.addProperty("column", diagnostic.getColumn());
            array.add(obj);
        }
        return array;
    }
}
