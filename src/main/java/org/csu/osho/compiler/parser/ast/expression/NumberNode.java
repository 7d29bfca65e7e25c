package org.csu.osho.compiler.parser.ast.expression;

import org.csu.osho.compiler.parser.ast.AstNode;

/**
 * AST 节点: 数字字面量
 */
public record NumberNode(double value) implements AstNode {
}
