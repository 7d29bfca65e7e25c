package org.csu.osho.compiler.parser.ast;

import java.util.List;

/**
 * AST 根节点: 一个完整的脚本。语句的顺序即执行顺序。
 */
public record ProgramNode(List<AstNode> statements) implements AstNode {

    public ProgramNode {
        statements = List.copyOf(statements);
    }
}
