package org.csu.osho.common.exception;

import org.csu.osho.compiler.lexer.Token;

/**
 * 语法分析阶段的自定义异常。遇到第一个错误即终止解析，不做错误恢复。
 */
public class ParseException extends RuntimeException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(Token token, String message) {
        super(String.format("Syntax Error at line %d, column %d: %s, but found '%s' (%s)",
                token.line(),
                token.column(),
                message,
                token.lexeme(),
                token.type()));
    }
}
