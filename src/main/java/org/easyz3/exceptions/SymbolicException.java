package org.easyz3.exceptions;

import lombok.Getter;

/**
 * 所有在构造、提交或读取模型时检测到的错误的基类。
 * 这些错误都在出错的调用处立即抛出，不会推迟到求解阶段。
 */
@Getter
public abstract class SymbolicException extends RuntimeException {

    private final ErrorKind kind;

    protected SymbolicException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
