package org.csu.osho.compiler.parser.ast.statement;

import org.csu.osho.compiler.parser.ast.AstNode;

/**
 * AST 节点: print 语句，输出表达式的数值
 */
public record PrintNode(AstNode value) implements AstNode {
}
