package org.csu.cpy.compiler.codegen;

import org.csu.cpy.common.exception.CodeGenerationException;
import org.csu.cpy.compiler.lexer.Lexer;
import org.csu.cpy.compiler.parser.Parser;
import org.csu.cpy.compiler.parser.ast.BlockNode;
import org.csu.cpy.compiler.parser.ast.ProgramNode;
import org.csu.cpy.compiler.parser.ast.StatementNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 代码生成器测试，覆盖每一种语句和表达式的翻译规则
 */
public class CodeGeneratorTest {

    private CodeGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new CodeGenerator("    ");
    }

    private String generate(String source) {
        ProgramNode program = new Parser(new Lexer(source).tokenize()).parse();
        return generator.generate(program);
    }

    @Test
    void testDeclarations() {
        assertEquals("x = 5\n", generate("int x = 5;"));
        assertEquals("y = 0\n", generate("int y;"));
        assertEquals("f = 0\n", generate("float f;"));
        assertEquals("f = 2.5\n", generate("float f = 2.5;"));
    }

    @Test
    void testAssignmentAndIncrement() {
        assertEquals("x = x * 2\ncount = count + 1\n", generate("x = x * 2; count++;"));
    }

    @Test
    void testIfElse() {
        String expected = """
                if x < 10:
                    x = x + 1
                else:
                    x = 0
                """;
        assertEquals(expected, generate("if (x < 10) { x = x + 1; } else { x = 0; }"));
    }

    @Test
    void testNestedBlocksIndentByDepth() {
        String source = "while (a > 0) { if (b) { b = 0; } a = a - 1; }";
        String expected = """
                while a > 0:
                    if b:
                        b = 0
                    a = a - 1
                """;
        assertEquals(expected, generate(source));
    }

    @Test
    void testForLoopUsesRightOperandAsBound() {
        String expected = """
                for i in range(0, n + 1):
                    total = total + i
                """;
        assertEquals(expected, generate("for (int i = 0; i < n + 1; i++) { total = total + i; }"));
    }

    @Test
    void testFunction() {
        String expected = """
                def add(a, b):
                    return a + b
                def zero():
                    return 0
                """;
        assertEquals(expected, generate("int add(int a, int b) { return a + b; } int zero() { return 0; }"));
    }

    @Test
    void testClassInitialisesEveryFieldToZero() {
        String expected = """
                class Point:
                    def __init__(self):
                        self.x = 0
                        self.y = 0
                """;
        assertEquals(expected, generate("class Point { int x; float y = 3.5; };"));
    }

    @Test
    void testClassInsideFunctionIsIndented() {
        String expected = """
                def f():
                    class Box:
                        def __init__(self):
                            self.w = 0
                    return 1
                """;
        assertEquals(expected, generate("int f() { class Box { int w; }; return 1; }"));
    }

    @Test
    void testOutput() {
        assertEquals("print(x, end='')\n", generate("cout << x;"));
        assertEquals("print(x, end='\\n')\n", generate("cout << x << endl;"));
        assertEquals("print(\"i = \", i, sep='', end='\\n')\n", generate("cout << \"i = \" << i << endl;"));
        assertEquals("print(a, b, sep='', end='')\n", generate("cout << a << b;"));
    }

    @Test
    void testLogicalOperatorsUseWordForms() {
        assertEquals("ok = a and b or not c\n", generate("ok = a && b || !c;"));
    }

    @Test
    void testIncludesProduceNoOutput() {
        assertEquals("x = 1\n", generate("#include <iostream>\nint x = 1;"));
    }

    @Test
    void testCustomIndentUnit() {
        CodeGenerator twoSpaces = new CodeGenerator("  ");
        ProgramNode program = new Parser(new Lexer("while (x) { x = 0; }").tokenize()).parse();
        assertEquals("while x:\n  x = 0\n", twoSpaces.generate(program));
    }

    @Test
    void testUnknownStatementNodeIsInternalError() {
        StatementNode unknown = new StatementNode() {
        };
        ProgramNode program = new ProgramNode(List.of(), new BlockNode(List.of(unknown)));
        CodeGenerationException e = assertThrows(CodeGenerationException.class, () -> generator.generate(program));
        assertTrue(e.getMessage().startsWith("Internal error"));
    }

    @Test
    void testFloatFormattingFollowsPythonRepr() {
        assertEquals("2.0", CodeGenerator.formatFloat(2.0));
        assertEquals("3.14", CodeGenerator.formatFloat(3.14));
        assertEquals("0.0", CodeGenerator.formatFloat(0.0));
        assertEquals("0.0001", CodeGenerator.formatFloat(0.0001));
        assertEquals("10000000000.0", CodeGenerator.formatFloat(1e10));
        assertEquals("1e+16", CodeGenerator.formatFloat(1e16));
        assertEquals("1.5e-05", CodeGenerator.formatFloat(1.5e-5));
        assertEquals("-2.5", CodeGenerator.formatFloat(-2.5));
    }

    @Test
    void testFloatFormattingUsesShortestRoundTripDigits() {
        assertEquals("1e+23", CodeGenerator.formatFloat(1e23));
        assertEquals("5e-324", CodeGenerator.formatFloat(Double.MIN_VALUE));
        assertEquals("2.82879384806159e+17", CodeGenerator.formatFloat(2.82879384806159E17));
        assertEquals("0.30000000000000004", CodeGenerator.formatFloat(0.1 + 0.2));
        assertEquals("1.2345678901234568e+17", CodeGenerator.formatFloat(123456789012345680.0));
    }

    @Test
    void testLargeFloatLiteralIsPrintedLikePython() {
        assertEquals("f = 1e+23\n", generate("float f = 100000000000000000000000.0;"));
    }
}
