package org.csu.osho.compiler.parser.ast.statement;

import org.csu.osho.compiler.parser.ast.AstNode;

/**
 * AST 节点: 声明一个新变量 (e.g., let x = 2)
 */
public record LetDeclarationNode(String name, AstNode value) implements AstNode {
}
