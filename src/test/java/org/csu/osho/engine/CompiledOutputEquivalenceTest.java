package org.csu.osho.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * 解释执行的输出必须与生成的C程序运行后的输出在数值上一致。
 * 需要 PATH 上有C编译器 (cc)，否则跳过。
 */
public class CompiledOutputEquivalenceTest {

    private Path workDir;
    private final ScriptProcessor scriptProcessor = new ScriptProcessor(message -> { });

    @BeforeEach
    void setUp() throws IOException {
        workDir = Files.createTempDirectory("osho-cc-test");
    }

    @AfterEach
    void tearDown() {
        deleteDirectory(workDir.toFile());
    }

    private void deleteDirectory(File directory) {
        File[] allContents = directory.listFiles();
        if (allContents != null) {
            for (File file : allContents) {
                deleteDirectory(file);
            }
        }
        directory.delete();
    }

    private static boolean compilerAvailable() {
        try {
            Process process = new ProcessBuilder("cc", "--version").redirectErrorStream(true).start();
            process.getInputStream().readAllBytes();
            return process.waitFor(30, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private List<Double> runCompiled(String code) throws Exception {
        Path source = workDir.resolve("output.c");
        Path executable = workDir.resolve("output");
        Files.writeString(source, code, StandardCharsets.UTF_8);

        Process compile = new ProcessBuilder("cc", source.toString(), "-o", executable.toString())
                .redirectErrorStream(true).start();
        String compileLog = new String(compile.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        assertTrue(compile.waitFor(60, TimeUnit.SECONDS), "compiler timed out");
        assertEquals(0, compile.exitValue(), "Compilation failed:\n" + compileLog);

        Process run = new ProcessBuilder(executable.toString()).start();
        String stdout = new String(run.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        assertTrue(run.waitFor(30, TimeUnit.SECONDS), "executable timed out");
        assertEquals(0, run.exitValue());

        List<Double> values = new ArrayList<>();
        for (String line : stdout.split("\\R")) {
            if (!line.isBlank()) {
                values.add(parseNumber(line));
            }
        }
        return values;
    }

    // printf 写 inf / -inf / nan (也可能是 -nan)，解释器写 inf / -inf / NaN
    private static double parseNumber(String text) {
        switch (text.trim().toLowerCase()) {
            case "inf":
                return Double.POSITIVE_INFINITY;
            case "-inf":
                return Double.NEGATIVE_INFINITY;
            case "nan":
            case "-nan":
                return Double.NaN;
            default:
                return Double.parseDouble(text.trim());
        }
    }

    private void assertEquivalent(String script) throws Exception {
        ScriptResult result = scriptProcessor.compile(script);
        assertTrue(result.success(), result.errorMessage());

        List<Double> compiled = runCompiled(result.generatedCode());
        assertEquals(result.output().size(), compiled.size());
        for (int i = 0; i < compiled.size(); i++) {
            double interpreted = parseNumber(result.output().get(i));
            // printf("%f") 只保留六位小数
            assertEquals(interpreted, compiled.get(i), 1e-6, "line " + i);
        }
    }

    @Test
    void testCompiledProgramMatchesInterpreter() throws Exception {
        assumeTrue(compilerAvailable(), "no C compiler on PATH");
        System.out.println("--- Test: interpreter and compiled program agree ---");

        assertEquivalent("let x = 2\nlet y = 3\nprint (x + y)");
        assertEquivalent("let a = 10\nlet b = 4\nprint a / b\nprint 2 + 3 * 4\nprint a - b - 1");
        assertEquivalent("let r = 1.5\nr = r * r\nprint r\nlet s = r + (2 * 3)\nprint s / 2");
        assertEquivalent("let n = 5\nn++\nn++\nn--\nprint n");
    }

    @Test
    void testNonFiniteValuesMatchInterpreter() throws Exception {
        assumeTrue(compilerAvailable(), "no C compiler on PATH");
        System.out.println("--- Test: division by zero and overflow agree ---");

        assertEquivalent("print 1 / 0\nprint 0 - 1 / 0\nprint 0 / 0");
        assertEquivalent("let big = 1" + "0".repeat(400) + "\nprint big\nprint 0 - big");
    }
}
