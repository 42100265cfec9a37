package org.easyz3.exceptions;

/**
 * 引用了未在当前会话中声明的符号。
 */
public class UndeclaredSymbolException extends SymbolicException {

    public UndeclaredSymbolException(String message) {
        super(ErrorKind.UNDECLARED_SYMBOL, message);
    }
}
