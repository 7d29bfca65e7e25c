package org.csu.osho.compiler.lexer;

/**
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * osho 脚本语言中所有可能出现的“单词”的分类。
 */
public enum TokenType {
    // ---- 关键字 (Keywords) ----
    LET,        // "let" 或 "const"，声明关键字
    PRINT,      // "print"

    // ---- 标识符 (Identifier) ----
    IDENTIFIER, // 变量名

    // ---- 常量 (Constants) ----
    NUMBER,     // 数字常量, e.g., 3, 2.5
    STRING,     // 字符串常量, e.g., "hello"

    // ---- 运算符 (Operators) ----
    PLUS,       // +
    INCREMENT,  // ++
    MINUS,      // -
    DECREMENT,  // --
    STAR,       // *
    SLASH,      // /
    EQUAL,      // =

    // ---- 分隔符 (Delimiters) ----
    LPAREN,     // (
    RPAREN,     // )

    // ---- 特殊 Token ----
    WHITESPACE, // 空白，只在扫描器内部产生，交给语法分析器之前会被过滤掉
    EOF         // End-Of-File，表示输入流结束
}
