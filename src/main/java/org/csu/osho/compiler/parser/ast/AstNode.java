package org.csu.osho.compiler.parser.ast;

/**
 * 所有AST节点的根接口。
 * AST 是一棵严格的树：每个非叶子节点独占自己的子节点，构建完成后不再被修改。
 */
public interface AstNode {
}
