package org.csu.osho.compiler.parser.ast.expression;

import org.csu.osho.compiler.parser.ast.AstNode;

/**
 * AST 节点: 对变量的引用
 */
public record IdentifierNode(String name) implements AstNode {
}
