package org.easyz3.symbolic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SolverOptionsTest {

    @Test
    @DisplayName("内置默认值：不限时、精度 20、开启模型")
    void testBuiltin() {
        SolverOptions options = SolverOptions.builtin();

        assertAll(
                () -> assertFalse(options.hasTimeout()),
                () -> assertNull(options.getTimeout()),
                () -> assertEquals(SolverOptions.DEFAULT_ALGEBRAIC_PRECISION, options.getAlgebraicPrecision()),
                () -> assertEquals(Map.of("model", "true"), options.getContextParameters())
        );
    }

    @Test
    @DisplayName("defaults 读取 classpath 上的 easyz3.properties")
    void testDefaults_FromClasspath() {
        SolverOptions options = SolverOptions.defaults();

        assertAll(
                () -> assertFalse(options.hasTimeout(), "timeout 0 表示不限时"),
                () -> assertEquals(20, options.getAlgebraicPrecision()),
                () -> assertEquals("true", options.getContextParameters().get("model"))
        );
    }

    @Test
    @DisplayName("fromProperties 应用各配置项")
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("easyz3.timeout.ms", "1500");
        properties.setProperty("easyz3.algebraic.precision", " 8 ");
        properties.setProperty("easyz3.z3.proof", "false");
        properties.setProperty("unrelated.key", "x");

        SolverOptions options = SolverOptions.fromProperties(properties);

        assertAll(
                () -> assertEquals(Duration.ofMillis(1500), options.getTimeout()),
                () -> assertEquals(8, options.getAlgebraicPrecision()),
                () -> assertEquals(Map.of("model", "true", "proof", "false"), options.getContextParameters())
        );
    }

    @Test
    @DisplayName("非法配置值应抛出 IllegalArgumentException")
    void testFromProperties_Invalid_ShouldThrow() {
        Properties notANumber = new Properties();
        notANumber.setProperty("easyz3.timeout.ms", "soon");
        Properties negative = new Properties();
        negative.setProperty("easyz3.timeout.ms", "-1");
        Properties zeroPrecision = new Properties();
        zeroPrecision.setProperty("easyz3.algebraic.precision", "0");

        assertAll(
                () -> assertThrows(IllegalArgumentException.class, () -> SolverOptions.fromProperties(notANumber)),
                () -> assertThrows(IllegalArgumentException.class, () -> SolverOptions.fromProperties(negative)),
                () -> assertThrows(IllegalArgumentException.class, () -> SolverOptions.fromProperties(zeroPrecision))
        );
    }

    @Test
    @DisplayName("with 方法返回副本，原对象不变")
    void testWithMethods_ShouldCopy() {
        SolverOptions base = SolverOptions.builtin();
        SolverOptions timed = base.withTimeout(Duration.ofSeconds(2));

        assertAll(
                () -> assertFalse(base.hasTimeout()),
                () -> assertEquals(Duration.ofSeconds(2), timed.getTimeout()),
                () -> assertFalse(timed.withoutTimeout().hasTimeout()),
                () -> assertFalse(base.withTimeout(Duration.ZERO).hasTimeout()),
                () -> assertEquals(5, base.withAlgebraicPrecision(5).getAlgebraicPrecision()),
                () -> assertThrows(UnsupportedOperationException.class, () -> base.getContextParameters().put("a", "b"))
        );
    }
}
