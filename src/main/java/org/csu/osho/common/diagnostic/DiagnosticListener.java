package org.csu.osho.common.diagnostic;

/**
 * 非致命诊断信息的接收方。
 * 词法分析阶段的异常（非法数字、无法识别的字符）只作为警告上报，不会中断处理流程。
 */
@FunctionalInterface
public interface DiagnosticListener {

    /**
     * 默认实现：直接输出到标准错误流。
     */
    DiagnosticListener STDERR = message -> System.err.println("WARNING: " + message);

    void warning(String message);
}
