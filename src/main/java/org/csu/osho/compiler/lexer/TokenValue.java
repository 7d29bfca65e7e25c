package org.csu.osho.compiler.lexer;

import java.util.Objects;

/**
 * Token 携带的值：无、一个 64 位浮点数，或一个字符串（标识符名、字符串字面量）。
 */
public final class TokenValue {

    public static final TokenValue NONE = new TokenValue(null, null);

    private final Double number;
    private final String text;

    private TokenValue(Double number, String text) {
        this.number = number;
        this.text = text;
    }

    public static TokenValue ofNumber(double number) {
        return new TokenValue(number, null);
    }

    public static TokenValue ofString(String text) {
        return new TokenValue(null, Objects.requireNonNull(text));
    }

    public boolean isNone() {
        return number == null && text == null;
    }

    public boolean isNumber() {
        return number != null;
    }

    public double asNumber() {
        if (number == null) {
            throw new IllegalStateException("Token value is not a number: " + this);
        }
        return number;
    }

    public String asString() {
        if (text == null) {
            throw new IllegalStateException("Token value is not a string: " + this);
        }
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TokenValue that = (TokenValue) o;
        return Objects.equals(number, that.number) && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, text);
    }

    @Override
    public String toString() {
        if (number != null) return "Number(" + number + ")";
        if (text != null) return "String(" + text + ")";
        return "None";
    }
}
