package org.easyz3.exceptions;

/**
 * 操作数本身非法，例如幂运算的指数不是非负整数字面量，或者无法转换为字面量的 Java 值。
 */
public class InvalidOperandException extends SymbolicException {

    public InvalidOperandException(String message) {
        super(ErrorKind.INVALID_OPERAND, message);
    }
}
