package org.csu.osho.compiler.parser.ast.expression;

/**
 * 二元运算符。所有运算符优先级相同，严格从左到右结合。
 */
public enum BinaryOperator {
    PLUS("+"),
    MINUS("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public double apply(double left, double right) {
        switch (this) {
            case PLUS:
                return left + right;
            case MINUS:
                return left - right;
            case MULTIPLY:
                return left * right;
            case DIVIDE:
                // 除以零按 IEEE754 处理，得到 Infinity 或 NaN
                return left / right;
            default:
                throw new IllegalStateException("Unknown operator: " + this);
        }
    }
}
