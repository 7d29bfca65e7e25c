package org.csu.osho.compiler;

import org.csu.osho.compiler.codegen.CodeGenerator;
import org.csu.osho.compiler.lexer.Lexer;
import org.csu.osho.compiler.parser.Parser;
import org.csu.osho.compiler.parser.ast.ProgramNode;
import org.csu.osho.compiler.parser.ast.expression.NumberNode;
import org.csu.osho.compiler.parser.ast.statement.AssignmentNode;
import org.csu.osho.compiler.parser.ast.statement.PrintNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @description: CodeGenerator 类的单元测试
 */
public class CodeGeneratorTest {

    private String generate(String source) {
        ProgramNode program = new Parser(new Lexer(source, message -> { }).tokenize()).parse();
        String code = new CodeGenerator().generate(program);
        System.out.println("Generated C:\n" + code);
        return code;
    }

    @Test
    void testFullProgram() {
        System.out.println("--- Running test: testFullProgram ---");
        String code = generate("let x = 2\nlet y = 3\nprint (x + y)");
        String expected = "#include <stdio.h>\n"
                + "\n"
                + "int main() {\n"
                + "    double x = 2.0;\n"
                + "    double y = 3.0;\n"
                + "    printf(\"%f\\n\", (x + y));\n"
                + "    return 0;\n"
                + "}\n";
        assertEquals(expected, code);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEmptyProgramStillHasEntryPoint() {
        assertEquals("#include <stdio.h>\n\nint main() {\n    return 0;\n}\n", generate(""));
    }

    @Test
    void testMutations() {
        String code = generate("let x = 5\nx = x * 2.5\nx++\nx--");
        assertTrue(code.contains("    x = (x * 2.5);\n"));
        assertTrue(code.contains("    x++;\n"));
        assertTrue(code.contains("    x--;\n"));
    }

    @Test
    void testBinaryExpressionsAreFullyParenthesized() {
        String code = generate("print 2 + 3 * 4 - 1");
        assertTrue(code.contains("printf(\"%f\\n\", (((2.0 + 3.0) * 4.0) - 1.0));"), code);
    }

    @Test
    void testWholeNumbersGetFractionalPart() {
        String code = generate("let a = 3\nlet b = 0.25\nlet c = 100");
        assertTrue(code.contains("double a = 3.0;"));
        assertTrue(code.contains("double b = 0.25;"));
        assertTrue(code.contains("double c = 100.0;"));
    }

    @Test
    void testOverflowingLiteralLowersToInfinityExpression() {
        String code = generate("let big = 1" + "0".repeat(400) + "\nprint big");
        assertTrue(code.contains("    double big = (1.0 / 0.0);\n"), code);
    }

    @Test
    void testGeneratorIsReusable() {
        CodeGenerator generator = new CodeGenerator();
        ProgramNode first = new ProgramNode(List.of(new PrintNode(new NumberNode(1))));
        ProgramNode second = new ProgramNode(List.of(new PrintNode(new NumberNode(2))));
        generator.generate(first);
        String code = generator.generate(second);
        assertFalse(code.contains("1.0"));
        assertTrue(code.contains("2.0"));
    }

    @Test
    void testUnloweredExpressionNodeIsRejected() {
        ProgramNode program = new ProgramNode(List.of(new PrintNode(new AssignmentNode("x", new NumberNode(1)))));
        assertThrows(IllegalStateException.class, () -> new CodeGenerator().generate(program));
    }
}
