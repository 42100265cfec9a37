package org.easyz3.exceptions;

/**
 * 函数调用的参数个数与定义域长度不符。
 */
public class InvalidArityException extends SymbolicException {

    public InvalidArityException(String message) {
        super(ErrorKind.INVALID_ARITY, message);
    }
}
