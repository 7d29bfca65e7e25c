package org.csu.osho.compiler.codegen;

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

/**
 * @description: 代码生成器
 * 把AST翻译成等价的C程序源码，交给外部C编译器编译。
 * 与语义分析器互相独立，不共享任何状态；调用方只能传入已通过语义分析的AST。
 */
public class CodeGenerator {

    private static final String HEADER = "#include <stdio.h>";
    private static final String FLOAT_TYPE = "double";
    private static final String PRINT_FORMAT = "\"%f\\n\"";
    private static final String INDENT = "    ";

    private final StringBuilder code = new StringBuilder();

    public String generate(ProgramNode program) {
        code.setLength(0);
        for (AstNode statement : program.statements()) {
            code.append(INDENT);
            visitStatement(statement);
            code.append('\n');
        }
        return wrapWithMain(code.toString());
    }

    private void visitStatement(AstNode node) {
        if (node instanceof LetDeclarationNode let) {
            code.append(FLOAT_TYPE).append(' ').append(let.name()).append(" = ");
            visitExpression(let.value());
            code.append(';');
        } else if (node instanceof AssignmentNode assignment) {
            code.append(assignment.name()).append(" = ");
            visitExpression(assignment.value());
            code.append(';');
        } else if (node instanceof IncrementNode increment) {
            code.append(increment.name()).append("++;");
        } else if (node instanceof DecrementNode decrement) {
            code.append(decrement.name()).append("--;");
        } else if (node instanceof PrintNode print) {
            code.append("printf(").append(PRINT_FORMAT).append(", ");
            visitExpression(print.value());
            code.append(");");
        } else {
            // 单独成句的表达式
            visitExpression(node);
            code.append(';');
        }
    }

    private void visitExpression(AstNode node) {
        if (node instanceof BinaryExpressionNode binary) {
            // 每个二元表达式都加括号，保证C的运算符优先级不改变从左到右的求值顺序
            code.append('(');
            visitExpression(binary.left());
            code.append(' ').append(binary.operator().getSymbol()).append(' ');
            visitExpression(binary.right());
            code.append(')');
        } else if (node instanceof NumberNode number) {
            code.append(NumberFormatter.cLiteral(number.value()));
        } else if (node instanceof IdentifierNode identifier) {
            code.append(identifier.name());
        } else {
            throw new IllegalStateException("Cannot lower " + node.getClass().getSimpleName() + " in expression position");
        }
    }

    private String wrapWithMain(String body) {
        return HEADER + "\n\n"
                + "int main() {\n"
                + body
                + INDENT + "return 0;\n"
                + "}\n";
    }
}
