package org.easyz3.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 一个已声明的符号：名称加 sort。
 * 只能通过 {@link DeclarationRegistry#declare(String, Sort)} 创建，创建后不可变。
 * 相等性基于全局唯一的 id，因此两个会话中的同名符号互不相等。
 */
@Getter
public final class Declaration implements Comparable<Declaration> {

    private static final Logger logger = LoggerFactory.getLogger(Declaration.class);

    private static final AtomicInteger NEXT_ID = new AtomicInteger(0);

    private final int id;
    private final String name;
    private final Sort sort;
    // 创建此声明的注册表
    private final int registryId;

    private final int hashCode;

    Declaration(String name, Sort sort, int registryId) {
        this.id = NEXT_ID.getAndIncrement();
        this.name = Objects.requireNonNull(name, "name 不能为 null");
        this.sort = Objects.requireNonNull(sort, "sort 不能为 null");
        this.registryId = registryId;
        this.hashCode = Objects.hash(id);
        logger.debug("创建了一个Declaration: {} : {} with id {}", name, sort, id);
    }

    public boolean isFunction() {
        return sort.isFunction();
    }

    @Override
    public int compareTo(Declaration o) {
        return Integer.compare(this.id, o.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Declaration that = (Declaration) o;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name;
    }
}
