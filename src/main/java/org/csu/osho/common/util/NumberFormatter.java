package org.csu.osho.common.util;

import java.math.BigDecimal;

/**
 * 浮点数的文本表示。
 * 解释器输出与C代码生成共用，保证两边对同一个数值的写法一致。
 */
public final class NumberFormatter {

    private NumberFormatter() {
    }

    /**
     * 自然十进制表示：整数不带小数部分 (5)，其余使用最短的可还原写法 (0.5)，从不使用科学计数法。
     */
    public static String display(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            // 保留 -0 的符号
            return 1.0 / value < 0 ? "-0" : "0";
        }
        return plain(value);
    }

    /**
     * C 语言字面量：整数值强制带上 ".0"，让C编译器把它当作浮点数。
     * 无穷大和 NaN 没有字面量，写成常量除法表达式，不需要额外的头文件。
     */
    public static String cLiteral(double value) {
        if (Double.isNaN(value)) {
            return "(0.0 / 0.0)";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "(1.0 / 0.0)" : "(-1.0 / 0.0)";
        }
        if (value == Math.rint(value)) {
            return display(value) + ".0";
        }
        return plain(value);
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
