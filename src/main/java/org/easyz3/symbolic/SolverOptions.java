package org.easyz3.symbolic;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * 求解配置：超时、代数数近似精度，以及传给 Z3 Context 的参数。
 * 此类是不可变的，{@code with*} 方法返回修改后的副本。
 * <p>
 * {@link #defaults()} 从 classpath 上的 {@value #RESOURCE} 读取：
 * <ul>
 *     <li>{@code easyz3.timeout.ms}：超时毫秒数，缺省或 0 表示不限时；</li>
 *     <li>{@code easyz3.algebraic.precision}：无理代数数近似为有理数时保留的小数位数；</li>
 *     <li>{@code easyz3.z3.<name>}：原样传给 Z3 Context 的参数。</li>
 * </ul>
 */
@Getter
public final class SolverOptions {

    private static final Logger logger = LoggerFactory.getLogger(SolverOptions.class);

    public static final String RESOURCE = "easyz3.properties";
    static final String TIMEOUT_KEY = "easyz3.timeout.ms";
    static final String PRECISION_KEY = "easyz3.algebraic.precision";
    static final String Z3_PREFIX = "easyz3.z3.";

    public static final int DEFAULT_ALGEBRAIC_PRECISION = 20;

    // null 表示不限时
    private final Duration timeout;
    private final int algebraicPrecision;
    private final Map<String, String> contextParameters;

    private SolverOptions(Duration timeout, int algebraicPrecision, Map<String, String> contextParameters) {
        if (timeout != null) {
            Validate.isTrue(!timeout.isNegative(), "超时不能为负: %s", timeout);
        }
        Validate.isTrue(algebraicPrecision > 0, "代数数精度必须为正: %d", algebraicPrecision);
        this.timeout = (timeout == null || timeout.isZero()) ? null : timeout;
        this.algebraicPrecision = algebraicPrecision;
        this.contextParameters = Collections.unmodifiableMap(new LinkedHashMap<>(contextParameters));
    }

    /**
     * 不读取任何配置文件的内置默认值：不限时，精度 20，开启模型生成。
     */
    public static SolverOptions builtin() {
        return new SolverOptions(null, DEFAULT_ALGEBRAIC_PRECISION, Map.of("model", "true"));
    }

    /**
     * 内置默认值，被 classpath 上的 {@value #RESOURCE}（如果存在）覆盖。
     */
    public static SolverOptions defaults() {
        try (InputStream in = SolverOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.debug("classpath 上没有 {}，使用内置默认配置", RESOURCE);
                return builtin();
            }
            Properties properties = new Properties();
            properties.load(in);
            SolverOptions options = fromProperties(properties);
            logger.debug("从 {} 读取配置: {}", RESOURCE, options);
            return options;
        } catch (IOException e) {
            logger.error("读取 {} 失败", RESOURCE, e);
            throw new UncheckedIOException("读取 " + RESOURCE + " 失败", e);
        }
    }

    /**
     * 以内置默认值为基础，应用给定属性。
     * @throws IllegalArgumentException 属性值无法解析。
     */
    public static SolverOptions fromProperties(Properties properties) {
        SolverOptions options = builtin();
        String timeout = properties.getProperty(TIMEOUT_KEY);
        if (StringUtils.isNotBlank(timeout)) {
            options = options.withTimeout(Duration.ofMillis(parseLong(TIMEOUT_KEY, timeout)));
        }
        String precision = properties.getProperty(PRECISION_KEY);
        if (StringUtils.isNotBlank(precision)) {
            options = options.withAlgebraicPrecision((int) parseLong(PRECISION_KEY, precision));
        }
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(Z3_PREFIX) && key.length() > Z3_PREFIX.length()) {
                options = options.withContextParameter(key.substring(Z3_PREFIX.length()), properties.getProperty(key).trim());
            }
        }
        return options;
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.error("配置项 {} 的值不是整数: {}", key, value);
            throw new IllegalArgumentException("配置项 " + key + " 的值不是整数: " + value, e);
        }
    }

    public SolverOptions withTimeout(Duration timeout) {
        return new SolverOptions(timeout, algebraicPrecision, contextParameters);
    }

    public SolverOptions withoutTimeout() {
        return new SolverOptions(null, algebraicPrecision, contextParameters);
    }

    public SolverOptions withAlgebraicPrecision(int precision) {
        return new SolverOptions(timeout, precision, contextParameters);
    }

    public SolverOptions withContextParameter(String name, String value) {
        Validate.notBlank(name, "参数名不能为空");
        Map<String, String> parameters = new LinkedHashMap<>(contextParameters);
        parameters.put(name, value);
        return new SolverOptions(timeout, algebraicPrecision, parameters);
    }

    public boolean hasTimeout() {
        return timeout != null;
    }

    @Override
    public String toString() {
        return "SolverOptions{timeout=" + (timeout == null ? "none" : timeout.toMillis() + "ms")
                + ", algebraicPrecision=" + algebraicPrecision
                + ", contextParameters=" + contextParameters + "}";
    }
}
