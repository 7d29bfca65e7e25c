package org.csu.osho.compiler.semantic;

import org.csu.osho.common.exception.SemanticException;
import org.csu.osho.common.util.NumberFormatter;
import org.csu.osho.compiler.parser.ast.AstNode;
import org.csu.osho.compiler.parser.ast.ProgramNode;
import org.csu.osho.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.osho.compiler.parser.ast.expression.IdentifierNode;
import org.csu.osho.compiler.parser.ast.expression.NumberNode;
import org.csu.osho.compiler.parser.ast.statement.AssignmentNode;
import org.csu.osho.compiler.parser.ast.statement.DecrementNode;
import org.csu.osho.compiler.parser.ast.statement.IncrementNode;
import org.csu.osho.compiler.parser.ast.statement.LetDeclarationNode;
import org.csu.osho.compiler.parser.ast.statement.PrintNode;

import java.util.function.Consumer;

/**
 * @description: 语义分析器
 * 按程序顺序遍历AST，检查变量的声明/使用规则，并在检查的同时执行程序（求值、打印）。
 * 分析与执行是同一遍：遇到第一个错误立即终止，之后的 print 不会被执行。
 */
public class SemanticAnalyzer {

    private final Consumer<String> output;

    /**
     * @param output 接收每条 print 语句输出的一行文本
     */
    public SemanticAnalyzer(Consumer<String> output) {
        this.output = output;
    }

    /**
     * 分析并执行整个程序。每次调用都使用一张新的符号表。
     * @return 分析结束时的符号表
     */
    public SymbolTable analyze(ProgramNode program) {
        SymbolTable symbols = new SymbolTable();
        analyzeStatement(program, symbols);
        return symbols;
    }

    private void analyzeStatement(AstNode node, SymbolTable symbols) {
        if (node instanceof ProgramNode program) {
            for (AstNode statement : program.statements()) {
                analyzeStatement(statement, symbols);
            }
        } else if (node instanceof LetDeclarationNode let) {
            // 先查重复声明，再对初始值求值
            symbols.requireUndeclared(let.name());
            symbols.declare(let.name(), evaluate(let.value(), symbols));
        } else if (node instanceof AssignmentNode assignment) {
            symbols.requireDeclared(assignment.name());
            symbols.assign(assignment.name(), evaluate(assignment.value(), symbols));
        } else if (node instanceof IncrementNode increment) {
            symbols.adjust(increment.name(), 1.0);
        } else if (node instanceof DecrementNode decrement) {
            symbols.adjust(decrement.name(), -1.0);
        } else if (node instanceof PrintNode print) {
            output.accept(NumberFormatter.display(evaluate(print.value(), symbols)));
        } else {
            throw new SemanticException("Unexpected AST node");
        }
    }

    private double evaluate(AstNode expr, SymbolTable symbols) {
        if (expr instanceof NumberNode number) {
            return number.value();
        }
        if (expr instanceof IdentifierNode identifier) {
            return symbols.lookup(identifier.name());
        }
        if (expr instanceof BinaryExpressionNode binary) {
            // 先左后右
            double left = evaluate(binary.left(), symbols);
            double right = evaluate(binary.right(), symbols);
            return binary.operator().apply(left, right);
        }
        throw new SemanticException("Unexpected AST node");
    }
}
