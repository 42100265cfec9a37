package org.easyz3.exceptions;

/**
 * 操作数或参数的 sort 不兼容（只允许 Int 到 Real 的提升）。
 */
public class SortMismatchException extends SymbolicException {

    public SortMismatchException(String message) {
        super(ErrorKind.TYPE_MISMATCH, message);
    }
}
