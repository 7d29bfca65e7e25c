package org.csu.osho.engine;

import java.util.List;

/**
 * 封装一次脚本处理的所有结果信息。
 */
public record ScriptResult(
        boolean success,        // 整个流程是否成功
        List<String> output,    // 解释执行时 print 输出的每一行 (失败时为出错前已输出的部分)
        String generatedCode,   // 生成的C源码，只有 compile 成功时才有
        String errorMessage     // 失败原因
) {
    public ScriptResult {
        output = List.copyOf(output);
    }

    // 静态工厂方法，用于解释执行成功的返回
    public static ScriptResult newRunResult(List<String> output) {
        return new ScriptResult(true, output, null, null);
    }

    // 静态工厂方法，用于编译成功的返回
    public static ScriptResult newCompileResult(List<String> output, String generatedCode) {
        return new ScriptResult(true, output, generatedCode, null);
    }

    // 静态工厂方法，用于语法/语义错误的返回
    public static ScriptResult newErrorResult(List<String> output, String errorMessage) {
        return new ScriptResult(false, output, null, errorMessage);
    }
}
