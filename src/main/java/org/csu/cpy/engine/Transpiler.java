package org.csu.cpy.engine;

import lombok.Getter;
import org.csu.cpy.common.exception.TranspileException;
import org.csu.cpy.compiler.codegen.CodeGenerator;
import org.csu.cpy.compiler.lexer.Lexer;
import org.csu.cpy.compiler.lexer.Token;
import org.csu.cpy.compiler.parser.Parser;
import org.csu.cpy.compiler.parser.ast.ProgramNode;
import org.csu.cpy.config.TranspilerConfig;

import java.util.List;

/**
 * @author hidyouth
 * @description: 翻译流水线的入口: 词法分析 -> 语法分析 -> 代码生成
 *
 * 每次调用都会新建 Lexer / Parser / CodeGenerator，
 * 因此同一个 Transpiler 可以被反复使用，调用之间不会共享行号等状态。
 */
public class Transpiler {

    @Getter
    private final TranspilerConfig config;

    public Transpiler() {
        this(TranspilerConfig.defaults());
    }

    public Transpiler(TranspilerConfig config) {
        this.config = config;
    }

    /**
     * 把 C++ 源码翻译成 Python 源码。
     * 失败时返回单行的错误描述，而不是抛出异常。
     */
    public String transpile(String source) {
        try {
            return transpileOrThrow(source);
        } catch (TranspileException e) {
            if (config.isDebug()) {
                System.err.println("[DEBUG] Translation failed: " + e.getMessage());
            }
            return e.getMessage();
        }
    }

    /**
     * 与 {@link #transpile(String)} 相同，但把失败作为异常抛出
     * @throws TranspileException 词法、语法或内部错误
     */
    public String transpileOrThrow(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();
        if (config.isDebug()) {
            System.out.println("[DEBUG] Tokens: " + tokens);
        }

        Parser parser = new Parser(tokens);
        ProgramNode ast = parser.parse();
        if (config.isDebug()) {
            System.out.println("[DEBUG] AST: " + ast);
        }

        CodeGenerator generator = new CodeGenerator(config.getIndentUnit());
        return generator.generate(ast);
    }
}
