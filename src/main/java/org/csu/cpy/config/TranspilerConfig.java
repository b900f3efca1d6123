package org.csu.cpy.config;

import lombok.Getter;

/**
 * @author hidyouth
 * @description: 翻译器配置，创建后不可修改
 */
@Getter
public class TranspilerConfig {

    public static final int DEFAULT_INDENT_WIDTH = 4;

    /**
     * 每一级缩进使用的文本，默认四个空格
     */
    private final String indentUnit;
    /**
     * 为 true 时把 Token 流和 AST 打印到标准输出
     */
    private final boolean debug;

    public TranspilerConfig(int indentWidth, boolean debug) {
        if (indentWidth < 1) {
            throw new IllegalArgumentException("Indent width must be positive, got " + indentWidth);
        }
        this.indentUnit = " ".repeat(indentWidth);
        this.debug = debug;
    }

    public static TranspilerConfig defaults() {
        return new TranspilerConfig(DEFAULT_INDENT_WIDTH, false);
    }
}
