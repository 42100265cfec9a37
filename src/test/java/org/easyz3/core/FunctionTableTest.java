package org.easyz3.core;

import org.easyz3.exceptions.InvalidArityException;
import org.easyz3.exceptions.SortMismatchException;
import org.easyz3.utils.Rational;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class FunctionTableTest {

    private Declaration f;
    private Declaration g;
    private FunctionTable table;

    @BeforeAll
    void setUp() {
        DeclarationRegistry registry = new DeclarationRegistry();
        f = registry.declare("f", Sort.function(Sort.REAL, Sort.INT, Sort.INT));
        g = registry.declare("g", Sort.function(Sort.BOOL, Sort.REAL));

        Map<List<Object>, Object> entries = new LinkedHashMap<>();
        entries.put(List.of(1, 2), Rational.valueOf(-3, 2));
        entries.put(List.of(BigInteger.ZERO, BigInteger.ZERO), 7);
        table = new FunctionTable(f, entries, 0);
    }

    @Test
    @DisplayName("条目与 else 值应按 sort 规范化")
    void testConstruction_ShouldNormalizeValues() {
        assertAll(
                () -> assertEquals(Rational.valueOf(7), table.getEntries().get(List.of(BigInteger.ZERO, BigInteger.ZERO))),
                () -> assertEquals(Rational.ZERO, table.getElseValue()),
                () -> assertEquals(2, table.getArity())
        );
    }

    @Test
    @DisplayName("apply：命中条目返回条目值，否则返回 else 值")
    void testApply() {
        assertAll(
                () -> assertEquals(Rational.valueOf(-3, 2), table.apply(1, 2)),
                () -> assertEquals(Rational.valueOf(-3, 2), table.apply(BigInteger.ONE, BigInteger.TWO)),
                () -> assertEquals(Rational.ZERO, table.apply(5, 5))
        );
    }

    @Test
    @DisplayName("Real 形参接受 Int 参数")
    void testApply_IntArgumentForRealParameter() {
        FunctionTable gTable = new FunctionTable(g, Map.of(List.of(Rational.valueOf(2)), true), false);

        assertAll(
                () -> assertEquals(Boolean.TRUE, gTable.apply(2)),
                () -> assertEquals(Boolean.TRUE, gTable.apply(2.0)),
                () -> assertEquals(Boolean.FALSE, gTable.apply(Rational.HALF))
        );
    }

    @Test
    @DisplayName("参数个数不符应抛出 InvalidArityException，类型不符应抛出 SortMismatchException")
    void testApply_InvalidArguments_ShouldThrow() {
        assertAll(
                () -> assertThrows(InvalidArityException.class, () -> table.apply(1)),
                () -> assertThrows(InvalidArityException.class, () -> table.apply(1, 2, 3)),
                () -> assertThrows(SortMismatchException.class, () -> table.apply(Rational.HALF, 1)),
                () -> assertThrows(SortMismatchException.class, () -> table.apply(true, 1))
        );
    }

    @Test
    @DisplayName("constant 只有 else 分支")
    void testConstant() {
        FunctionTable constant = FunctionTable.constant(g, false);

        assertAll(
                () -> assertTrue(constant.getEntries().isEmpty()),
                () -> assertEquals(Boolean.FALSE, constant.apply(42)),
                () -> assertEquals("[else -> false]", constant.toString())
        );
    }

    @Test
    @DisplayName("toString 列出条目和 else 值")
    void testToString() {
        assertEquals("[(1, 2) -> -3/2, (0, 0) -> 7, else -> 0]", table.toString());
    }
}
