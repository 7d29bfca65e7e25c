package org.csu.osho.engine;

import lombok.Getter;
import org.csu.osho.common.diagnostic.DiagnosticListener;
import org.csu.osho.common.exception.ParseException;
import org.csu.osho.common.exception.SemanticException;
import org.csu.osho.compiler.codegen.CodeGenerator;
import org.csu.osho.compiler.lexer.Lexer;
import org.csu.osho.compiler.parser.Parser;
import org.csu.osho.compiler.parser.ast.ProgramNode;
import org.csu.osho.compiler.semantic.SemanticAnalyzer;

import java.util.ArrayList;
import java.util.List;

/**
 * 脚本处理的入口：词法分析 -> 语法分析 -> 语义分析(执行) -> 代码生成。
 * 语法错误和语义错误只在这里被捕获，并转换成失败的 {@link ScriptResult}。
 */
public class ScriptProcessor {

    @Getter
    private final DiagnosticListener diagnostics;

    public ScriptProcessor() {
        this(DiagnosticListener.STDERR);
    }

    public ScriptProcessor(DiagnosticListener diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * 解析并解释执行脚本。
     */
    public ScriptResult run(String source) {
        List<String> output = new ArrayList<>();
        try {
            ProgramNode program = parse(source);
            new SemanticAnalyzer(output::add).analyze(program);
            return ScriptResult.newRunResult(output);
        } catch (ParseException | SemanticException e) {
            System.err.println("ERROR: " + e.getMessage());
            return ScriptResult.newErrorResult(output, e.getMessage());
        }
    }

    /**
     * 解析、校验并生成C代码。只有通过语义分析的程序才会进入代码生成。
     */
    public ScriptResult compile(String source) {
        List<String> output = new ArrayList<>();
        try {
            ProgramNode program = parse(source);
            new SemanticAnalyzer(output::add).analyze(program);
            String code = new CodeGenerator().generate(program);
            return ScriptResult.newCompileResult(output, code);
        } catch (ParseException | SemanticException e) {
            System.err.println("ERROR: " + e.getMessage());
            return ScriptResult.newErrorResult(output, e.getMessage());
        }
    }

    /**
     * 词法分析 + 语法分析。
     */
    public ProgramNode parse(String source) {
        Lexer lexer = new Lexer(source, diagnostics);
        Parser parser = new Parser(lexer.tokenize());
        return parser.parse();
    }

    /**
     * 解释执行并把 print 的输出写到标准输出。错误已由 {@link #run} 写到标准错误流。
     */
    public boolean execute(String source) {
        ScriptResult result = run(source);
        result.output().forEach(System.out::println);
        return result.success();
    }
}
