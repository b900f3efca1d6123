package org.csu.cpy.cli;

import org.csu.cpy.common.exception.ParseException;
import org.csu.cpy.compiler.lexer.Token;
import org.csu.cpy.compiler.lexer.TokenType;
import org.csu.cpy.engine.Transpiler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Scanner;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TranspilerShellTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;

    @BeforeEach
    void setUp() {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
    }

    private TranspilerShell shellFor(Transpiler transpiler, String input) {
        return new TranspilerShell(transpiler,
                new Scanner(input),
                new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testInteractiveSessionSendsAccumulatedSource() {
        Transpiler transpiler = Mockito.mock(Transpiler.class);
        when(transpiler.transpile("int x = 1;\nx++;\n")).thenReturn("x = 1\nx = x + 1\n");

        shellFor(transpiler, "int x = 1;\nx++;\ngo;\nexit;\n").run();

        verify(transpiler).transpile("int x = 1;\nx++;\n");
        assertTrue(out().contains("x = 1\nx = x + 1\n"));
        assertTrue(out().endsWith("Bye!" + System.lineSeparator()));
    }

    @Test
    void testClearDiscardsPendingSource() {
        Transpiler transpiler = Mockito.mock(Transpiler.class);
        when(transpiler.transpile(anyString())).thenReturn("");

        shellFor(transpiler, "int broken\nclear;\nint y;\ngo;\nexit;\n").run();

        verify(transpiler).transpile("int y;\n");
        verify(transpiler, never()).transpile("int broken\nint y;\n");
    }

    @Test
    void testVariableNamedSourceIsKeptAsCode() {
        Transpiler transpiler = Mockito.mock(Transpiler.class);
        when(transpiler.transpile(anyString())).thenReturn("");

        shellFor(transpiler, "int source;\nsource = 5;\nsource ++;\ngo;\nexit;\n").run();

        verify(transpiler).transpile("int source;\nsource = 5;\nsource ++;\n");
        assertEquals("", err());
    }

    @Test
    void testAssignmentToSourceIsTranslated() {
        shellFor(new Transpiler(), "int source;\nsource = 5;\ngo;\nexit;\n").run();

        assertTrue(out().contains("source = 0\nsource = 5\n"), out());
        assertEquals("", err());
    }

    @Test
    void testPendingSourceIsTranslatedAtEndOfInput() {
        Transpiler transpiler = new Transpiler();

        shellFor(transpiler, "int z = 3;\n").run();

        assertTrue(out().contains("z = 3\n"), out());
    }

    @Test
    void testErrorsAreShownInline() {
        shellFor(new Transpiler(), "int x = @;\ngo;\nexit;\n").run();

        assertTrue(out().contains("Lexical error at line 1"), out());
    }

    @Test
    void testSourceCommandTranslatesFile() throws IOException {
        Path file = tempDir.resolve("loop.cpp");
        Files.writeString(file, "while (n > 0) { n = n - 1; }\n");

        shellFor(new Transpiler(), "source " + file + ";\nexit;\n").run();

        assertTrue(out().contains("while n > 0:\n    n = n - 1\n"), out());
    }

    @Test
    void testTranslateFileReportsMissingFile() {
        boolean ok = shellFor(new Transpiler(), "").translateFile(tempDir.resolve("missing.cpp"));

        assertFalse(ok);
        assertTrue(err().contains("File not found"));
    }

    @Test
    void testTranslateFileReportsTranslationErrorsOnErr() throws IOException {
        Path file = tempDir.resolve("bad.cpp");
        Files.writeString(file, "int x = ;");
        Transpiler transpiler = Mockito.mock(Transpiler.class);
        Token semicolon = new Token(TokenType.SEMICOLON, ";", null, 1, 9);
        when(transpiler.transpileOrThrow("int x = ;")).thenThrow(new ParseException(semicolon, "an expression"));

        boolean ok = shellFor(transpiler, "").translateFile(file);

        assertFalse(ok);
        assertTrue(err().startsWith("bad.cpp: Syntax error at line 1, column 9"), err());
        assertEquals("", out());
    }
}
