package org.easyz3.exceptions;

/**
 * 在最近一次求解结果不是 SAT 时读取模型。
 */
public class NoModelAvailableException extends SymbolicException {

    public NoModelAvailableException(String message) {
        super(ErrorKind.NO_MODEL_AVAILABLE, message);
    }
}
