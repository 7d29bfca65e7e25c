package org.csu.osho.compiler.semantic;

import org.csu.osho.common.exception.SemanticException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 符号表：变量名到当前数值的映射。
 * 生命周期仅限一次语义分析，由 {@link SemanticAnalyzer} 独占，不在多次分析之间共享。
 */
public class SymbolTable {

    private final Map<String, Double> variables = new LinkedHashMap<>();

    /**
     * 插入新变量。调用方须先用 {@link #requireUndeclared} 检查重复声明。
     */
    public void declare(String name, double value) {
        variables.put(name, value);
    }

    /**
     * 覆盖已有变量的值。调用方须先用 {@link #requireDeclared} 检查。
     */
    public void assign(String name, double value) {
        variables.put(name, value);
    }

    public double lookup(String name) {
        requireDeclared(name);
        return variables.get(name);
    }

    /**
     * 原地加上 delta。
     */
    public void adjust(String name, double delta) {
        variables.put(name, lookup(name) + delta);
    }

    public void requireUndeclared(String name) {
        if (variables.containsKey(name)) {
            throw new SemanticException("Variable '" + name + "' is already declared");
        }
    }

    public void requireDeclared(String name) {
        if (!variables.containsKey(name)) {
            throw new SemanticException("Variable '" + name + "' is not declared");
        }
    }

    @Override
    public String toString() {
        return "SymbolTable" + variables;
    }
}
