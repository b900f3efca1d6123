package org.csu.cpy.common.exception;

/**
 * @author hidyouth
 * @description: 翻译流水线中所有致命错误的公共父类
 */
public class TranspileException extends RuntimeException {

    public TranspileException(String message) {
        super(message);
    }
}
