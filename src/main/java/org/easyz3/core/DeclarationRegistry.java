package org.easyz3.core;

import org.apache.commons.lang3.StringUtils;
import org.easyz3.exceptions.DuplicateDeclarationException;
import org.easyz3.exceptions.InvalidOperandException;
import org.easyz3.exceptions.UndeclaredSymbolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 一个会话中已声明符号的集合，名称唯一，按声明顺序保存。
 * 不是线程安全的：每个会话独占自己的注册表。
 */
public final class DeclarationRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DeclarationRegistry.class);

    private static final AtomicInteger NEXT_ID = new AtomicInteger(0);

    private final int id;
    private final Map<String, Declaration> declarations = new LinkedHashMap<>();

    public DeclarationRegistry() {
        this.id = NEXT_ID.getAndIncrement();
    }

    /**
     * 声明一个新符号。
     * @throws DuplicateDeclarationException 名称已被声明。
     * @throws InvalidOperandException 名称为空白。
     */
    public Declaration declare(String name, Sort sort) {
        Objects.requireNonNull(sort, "sort 不能为 null");
        if (StringUtils.isBlank(name)) {
            logger.error("尝试声明名称为空的符号");
            throw new InvalidOperandException("符号名称不能为空");
        }
        if (declarations.containsKey(name)) {
            logger.error("重复声明符号 '{}'，已有声明: {} : {}", name, name, declarations.get(name).getSort());
            throw new DuplicateDeclarationException("符号 '" + name + "' 已在此会话中声明");
        }
        Declaration declaration = new Declaration(name, sort, id);
        declarations.put(name, declaration);
        logger.info("声明符号: {} : {}", name, sort);
        return declaration;
    }

    /**
     * @throws UndeclaredSymbolException 名称未声明。
     */
    public Declaration lookup(String name) {
        Declaration declaration = declarations.get(name);
        if (declaration == null) {
            logger.error("查找未声明的符号 '{}'", name);
            throw new UndeclaredSymbolException("符号 '" + name + "' 未在此会话中声明");
        }
        return declaration;
    }

    /**
     * 检查给定声明是否由此注册表创建。
     */
    public boolean contains(Declaration declaration) {
        return declaration.getRegistryId() == id && declarations.get(declaration.getName()) == declaration;
    }

    public List<Declaration> getDeclarations() {
        return Collections.unmodifiableList(new ArrayList<>(declarations.values()));
    }

    public int size() {
        return declarations.size();
    }

    @Override
    public String toString() {
        return declarations.values().stream()
                .map(d -> d.getName() + " : " + d.getSort())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
