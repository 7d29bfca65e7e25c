package org.csu.osho.compiler.parser.ast.statement;

import org.csu.osho.compiler.parser.ast.AstNode;

/**
 * AST 节点: 给已声明的变量重新赋值 (e.g., x = x + 1)
 */
public record AssignmentNode(String name, AstNode value) implements AstNode {
}
