package org.csu.osho.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)，即源码中 [start, end) 的切片
 * @param value 词法单元携带的值 (数字或字符串)，可能为 {@link TokenValue#NONE}
 * @param start 在源码中的起始偏移 (包含)
 * @param end 在源码中的结束偏移 (不包含)
 * @param line 所在的行号
 * @param column 所在的列号
 */
public record Token(TokenType type, String lexeme, TokenValue value, int start, int end, int line, int column) {

    @Override
    public String toString() {
        // 重写toString方法，方便调试和打印
        return String.format("Token[Type=%-10s, Lexeme='%s', Value=%s, Span=%d..%d, Position=%d:%d]",
                type, lexeme, value, start, end, line, column);
    }
}
