package org.csu.osho.compiler.parser.ast.expression;

import org.csu.osho.compiler.parser.ast.AstNode;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., x + 2)
 */
public record BinaryExpressionNode(
        AstNode left,
        BinaryOperator operator,
        AstNode right
) implements AstNode {
}
