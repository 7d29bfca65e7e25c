package org.csu.osho.compiler.parser;

import org.csu.osho.common.exception.ParseException;
import org.csu.osho.compiler.lexer.Token;
import org.csu.osho.compiler.lexer.TokenType;
import org.csu.osho.compiler.parser.ast.AstNode;
import org.csu.osho.compiler.parser.ast.ProgramNode;
import org.csu.osho.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.osho.compiler.parser.ast.expression.BinaryOperator;
import org.csu.osho.compiler.parser.ast.expression.IdentifierNode;
import org.csu.osho.compiler.parser.ast.expression.NumberNode;
import org.csu.osho.compiler.parser.ast.statement.AssignmentNode;
import org.csu.osho.compiler.parser.ast.statement.DecrementNode;
import org.csu.osho.compiler.parser.ast.statement.IncrementNode;
import org.csu.osho.compiler.parser.ast.statement.LetDeclarationNode;
import org.csu.osho.compiler.parser.ast.statement.PrintNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)
 *
 * <pre>
 * program     := declaration* EOF
 * declaration := "let" IDENT "=" expression | statement
 * statement   := "print" expression
 *              | expression ( "=" expression | "++" | "--" )?
 * expression  := primary ( ("+"|"-"|"*"|"/") primary )*
 * primary     := NUMBER | IDENT | "(" expression ")"
 *              | "=" expression | "++" | "--"
 * </pre>
 * 所有二元运算符优先级相同，从左到右结合。
 * primary 中的 "=", "++", "--" 以前一个已消耗的Token作为目标变量名。
 */
public class Parser {

    private final List<Token> tokens;
    private int position = 0;

    private static final Map<TokenType, BinaryOperator> BINARY_OPERATORS = Map.of(
            TokenType.PLUS, BinaryOperator.PLUS,
            TokenType.MINUS, BinaryOperator.MINUS,
            TokenType.STAR, BinaryOperator.MULTIPLY,
            TokenType.SLASH, BinaryOperator.DIVIDE
    );

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        this.tokens = tokens;
    }

    public ProgramNode parse() {
        List<AstNode> statements = new ArrayList<>();
        while (!isAtEnd()) {
            statements.add(parseDeclaration());
        }
        return new ProgramNode(statements);
    }

    private AstNode parseDeclaration() {
        if (match(TokenType.LET)) {
            return parseLetDeclaration();
        }
        return parseStatement();
    }

    private LetDeclarationNode parseLetDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expected identifier after 'let'");
        consume(TokenType.EQUAL, "Expected '=' after let declaration");
        AstNode value = parseExpression();
        return new LetDeclarationNode(name.value().asString(), value);
    }

    private AstNode parseStatement() {
        if (match(TokenType.PRINT)) {
            return new PrintNode(parseExpression());
        }
        return parseExpressionStatement();
    }

    private AstNode parseExpressionStatement() {
        AstNode expr = parseExpression();
        if (expr instanceof IdentifierNode identifier && match(TokenType.EQUAL)) {
            return new AssignmentNode(identifier.name(), parseExpression());
        }
        if (match(TokenType.INCREMENT)) {
            if (expr instanceof IdentifierNode identifier) {
                return new IncrementNode(identifier.name());
            }
            throw new ParseException(previous(), "Expected identifier before '++'");
        }
        if (match(TokenType.DECREMENT)) {
            if (expr instanceof IdentifierNode identifier) {
                return new DecrementNode(identifier.name());
            }
            throw new ParseException(previous(), "Expected identifier before '--'");
        }
        return expr;
    }

    private AstNode parseExpression() {
        AstNode left = parsePrimary();
        BinaryOperator operator;
        while ((operator = matchBinaryOperator()) != null) {
            AstNode right = parsePrimary();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private AstNode parsePrimary() {
        // 在向前看之前记住上一个Token，"=", "++", "--" 需要用它作为目标变量
        Token prior = position > 0 ? previous() : null;

        if (match(TokenType.NUMBER)) {
            Token number = previous();
            if (!number.value().isNumber()) {
                throw new ParseException(number, "Expected number");
            }
            return new NumberNode(number.value().asNumber());
        }
        if (match(TokenType.IDENTIFIER)) {
            return new IdentifierNode(previous().value().asString());
        }
        if (match(TokenType.EQUAL)) {
            String target = targetName(prior, "=");
            return new AssignmentNode(target, parseExpression());
        }
        if (match(TokenType.LPAREN)) {
            AstNode expr = parseExpression();
            consume(TokenType.RPAREN, "Expected ')' after expression");
            return expr;
        }
        if (match(TokenType.INCREMENT)) {
            return new IncrementNode(targetName(prior, "++"));
        }
        if (match(TokenType.DECREMENT)) {
            return new DecrementNode(targetName(prior, "--"));
        }
        throw new ParseException(peek(), "Expected expression");
    }

    private String targetName(Token prior, String operator) {
        if (prior == null || prior.type() != TokenType.IDENTIFIER) {
            throw new ParseException(previous(), "Expected identifier before '" + operator + "'");
        }
        return prior.value().asString();
    }

    private BinaryOperator matchBinaryOperator() {
        BinaryOperator operator = BINARY_OPERATORS.get(peek().type());
        if (operator != null) {
            advance();
        }
        return operator;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw new ParseException(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
