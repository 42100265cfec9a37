package org.easyz3.exceptions;

/**
 * 本地可检测的错误类别。
 * 求解器返回的 UNKNOWN 不是错误，而是 {@link org.easyz3.symbolic.SolveResult} 的一种结果。
 */
public enum ErrorKind {
    DUPLICATE_DECLARATION,
    UNDECLARED_SYMBOL,
    TYPE_MISMATCH,
    INVALID_ARITY,
    INVALID_OPERAND,
    NO_MODEL_AVAILABLE
}
