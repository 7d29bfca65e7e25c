package org.csu.osho.compiler.lexer;

import lombok.Getter;
import org.csu.osho.common.diagnostic.DiagnosticListener;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的脚本源码分解为一系列的Token。
 * 单遍扫描，只向前看一个字符。遇到无法识别的字符或非法数字时只发出警告，不会抛出异常。
 */
public class Lexer {

    private final String input;
    private final DiagnosticListener diagnostics;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号

    // 本次扫描产生的所有警告，按出现顺序保存
    @Getter
    private final List<String> warnings = new ArrayList<>();

    // 标识符与字符串常量的驻留池，同名的标识符共享同一个 String 实例
    private final Map<String, String> atoms = new HashMap<>();

    private List<Token> scanned;

    // 关键字映射表
    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("let", TokenType.LET);
        keywords.put("const", TokenType.LET);
        keywords.put("print", TokenType.PRINT);
    }

    public Lexer(String input) {
        this(input, DiagnosticListener.STDERR);
    }

    public Lexer(String input, DiagnosticListener diagnostics) {
        this.input = input;
        this.diagnostics = diagnostics;
    }

    /**
     * 主方法，执行词法分析并返回交给语法分析器的Token
     * 空白Token已被过滤，列表以唯一的一个EOF结尾。
     * @return Token列表
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : scanAll()) {
            if (token.type() != TokenType.WHITESPACE) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * 扫描整个输入，保留空白Token。多次调用返回同一次扫描的结果。
     */
    List<Token> scanAll() {
        if (scanned == null) {
            List<Token> tokens = new ArrayList<>();
            Token token;
            do {
                token = nextToken();
                if (token != null) {
                    tokens.add(token);
                }
            } while (token == null || token.type() != TokenType.EOF);
            scanned = List.copyOf(tokens);
        }
        return scanned;
    }

    /**
     * 获取下一个Token
     * @return 解析出的下一个Token；遇到被跳过的非法字符时返回 null
     */
    private Token nextToken() {
        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", TokenValue.NONE, position, position, line, column);
        }

        char currentChar = peek();

        if (Character.isWhitespace(currentChar)) {
            return readWhitespace();
        }

        // 识别标识符或关键字
        if (isLetter(peekCodePoint())) {
            return readIdentifierOrKeyword();
        }

        // 识别数字
        if (isDigit(currentChar)) {
            return readNumber();
        }

        // 识别字符串
        if (currentChar == '"') {
            return readString();
        }

        // 识别运算符和分隔符
        switch (currentChar) {
            case '+':
                if (peekNext() == '+') {
                    return consumeAndReturn(TokenType.INCREMENT, 2);
                }
                return consumeAndReturn(TokenType.PLUS, 1);
            case '-':
                if (peekNext() == '-') {
                    return consumeAndReturn(TokenType.DECREMENT, 2);
                }
                return consumeAndReturn(TokenType.MINUS, 1);
            case '*':
                return consumeAndReturn(TokenType.STAR, 1);
            case '/':
                return consumeAndReturn(TokenType.SLASH, 1);
            case '=':
                return consumeAndReturn(TokenType.EQUAL, 1);
            case '(':
                return consumeAndReturn(TokenType.LPAREN, 1);
            case ')':
                return consumeAndReturn(TokenType.RPAREN, 1);
            default:
                String unknown = new String(Character.toChars(peekCodePoint()));
                warn(String.format("Unrecognized character '%s' at line %d, column %d, skipping", unknown, line, column));
                advance();
                return null;
        }
    }

    private Token readWhitespace() {
        int startPos = position;
        int startLine = line;
        int startCol = column;
        while (position < input.length() && Character.isWhitespace(peek())) {
            advance();
        }
        return new Token(TokenType.WHITESPACE, input.substring(startPos, position), TokenValue.NONE,
                startPos, position, startLine, startCol);
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isIdentifierPart(peekCodePoint())) {
            advance();
        }
        String text = input.substring(startPos, position);
        // 关键字区分大小写
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        return new Token(type, text, TokenValue.ofString(intern(text)), startPos, position, line, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        // 数字和小数点都会被收集，不检查小数点的个数，交给 parseDouble 判断
        while (position < input.length() && (isDigit(peek()) || peek() == '.')) {
            advance();
        }
        String number = input.substring(startPos, position);
        TokenValue value;
        try {
            value = TokenValue.ofNumber(Double.parseDouble(number));
        } catch (NumberFormatException e) {
            warn(String.format("Malformed number '%s' at line %d, column %d", number, line, startCol));
            value = TokenValue.NONE;
        }
        return new Token(TokenType.NUMBER, number, value, startPos, position, line, startCol);
    }

    private Token readString() {
        int startPos = position;
        int startLine = line;
        int startCol = column;
        advance(); // 跳过起始的双引号
        int contentStart = position;
        while (position < input.length() && peek() != '"') {
            advance();
        }
        String text = input.substring(contentStart, position);
        if (position < input.length()) {
            advance(); // 跳过结束的双引号
        }
        // 未闭合的字符串一直读到输入末尾，不报错
        return new Token(TokenType.STRING, input.substring(startPos, position), TokenValue.ofString(intern(text)),
                startPos, position, startLine, startCol);
    }

    // --- 辅助方法 ---

    private char peek() {
        if (position >= input.length()) return '\0'; // 文件结束符
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    // 按码点前进，代理对 (如 𝑥) 作为一个字符、占一列
    private void advance() {
        int codePoint = input.codePointAt(position);
        if (codePoint == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        position += Character.charCount(codePoint);
    }

    private Token consumeAndReturn(TokenType type, int length) {
        int startPos = position;
        Token token = new Token(type, input.substring(startPos, startPos + length), TokenValue.NONE,
                startPos, startPos + length, line, column);
        for (int i = 0; i < length; i++) {
            advance();
        }
        return token;
    }

    private String intern(String text) {
        return atoms.computeIfAbsent(text, k -> k);
    }

    private void warn(String message) {
        warnings.add(message);
        diagnostics.warning(message);
    }

    private int peekCodePoint() {
        if (position >= input.length()) return -1;
        return input.codePointAt(position);
    }

    private boolean isLetter(int codePoint) {
        return Character.isLetter(codePoint);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isIdentifierPart(int codePoint) {
        return Character.isLetterOrDigit(codePoint) || codePoint == '_';
    }
}
