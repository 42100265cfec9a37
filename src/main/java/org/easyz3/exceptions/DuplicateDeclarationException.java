package org.easyz3.exceptions;

/**
 * 同一会话中重复声明了同名符号。
 */
public class DuplicateDeclarationException extends SymbolicException {

    public DuplicateDeclarationException(String message) {
        super(ErrorKind.DUPLICATE_DECLARATION, message);
    }
}
