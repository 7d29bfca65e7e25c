package org.csu.osho.compiler.parser.ast.statement;

import org.csu.osho.compiler.parser.ast.AstNode;

/**
 * AST 节点: x--
 */
public record DecrementNode(String name) implements AstNode {
}
