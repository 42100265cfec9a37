package org.easyz3.core;

import org.easyz3.exceptions.SortMismatchException;
import org.easyz3.exceptions.UndeclaredSymbolException;
import org.easyz3.expressions.Expression;
import org.easyz3.expressions.Expressions;
import org.easyz3.expressions.Ref;
import org.easyz3.utils.Rational;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ValuationTest {

    private Ref n;
    private Ref x;
    private Ref b;
    private Ref f;
    private Valuation valuation;

    @BeforeAll
    void setUp() {
        DeclarationRegistry registry = new DeclarationRegistry();
        n = Expressions.ref(registry.declare("n", Sort.INT));
        x = Expressions.ref(registry.declare("x", Sort.REAL));
        b = Expressions.ref(registry.declare("b", Sort.BOOL));
        f = Expressions.ref(registry.declare("f", Sort.function(Sort.REAL, Sort.INT, Sort.INT)));

        Map<Declaration, Object> values = new LinkedHashMap<>();
        values.put(n.getDeclaration(), 3);
        values.put(x.getDeclaration(), Rational.valueOf(3, 2));
        values.put(b.getDeclaration(), false);
        values.put(f.getDeclaration(), new FunctionTable(f.getDeclaration(),
                Map.of(List.of(3, 4), Rational.valueOf(-3)), Rational.ZERO));
        valuation = Valuation.of(values);
    }

    @Nested
    @DisplayName("读取值 (Value Access)")
    class AccessTests {

        @Test
        @DisplayName("按引用、声明和名称读取，值已规范化")
        void testGet() {
            assertAll(
                    () -> assertEquals(BigInteger.valueOf(3), valuation.get(n)),
                    () -> assertEquals(BigInteger.valueOf(3), valuation.get(n.getDeclaration())),
                    () -> assertEquals(Rational.valueOf(3, 2), valuation.get("x")),
                    () -> assertEquals("{n=3, x=3/2, b=false, f=[(3, 4) -> -3, else -> 0]}", valuation.toString())
            );
        }

        @Test
        @DisplayName("类型化读取")
        void testTypedGetters() {
            assertAll(
                    () -> assertEquals(BigInteger.valueOf(3), valuation.getInt(n)),
                    () -> assertEquals(Rational.valueOf(3, 2), valuation.getReal(x)),
                    () -> assertFalse(valuation.getBool(b)),
                    () -> assertEquals(Rational.valueOf(-3), valuation.getFunction(f).apply(3, 4))
            );
        }

        @Test
        @DisplayName("类型不符应抛出 SortMismatchException")
        void testTypedGetters_WrongKind_ShouldThrow() {
            assertAll(
                    () -> assertThrows(SortMismatchException.class, () -> valuation.getInt(x)),
                    () -> assertThrows(SortMismatchException.class, () -> valuation.getBool(n)),
                    () -> assertThrows(SortMismatchException.class, () -> valuation.getFunction(n))
            );
        }

        @Test
        @DisplayName("其他会话的声明应抛出 UndeclaredSymbolException")
        void testGet_ForeignDeclaration_ShouldThrow() {
            Declaration foreign = new DeclarationRegistry().declare("n", Sort.INT);

            assertAll(
                    () -> assertThrows(UndeclaredSymbolException.class, () -> valuation.get(foreign)),
                    () -> assertThrows(UndeclaredSymbolException.class, () -> valuation.get("missing")),
                    () -> assertFalse(valuation.contains(foreign))
            );
        }

        @Test
        @DisplayName("函数符号的值必须是它自己的函数表")
        void testOf_FunctionValueMustBeTable() {
            Map<Declaration, Object> bad = Map.of(f.getDeclaration(), 1);

            assertThrows(SortMismatchException.class, () -> Valuation.of(bad));
        }
    }

    @Nested
    @DisplayName("表达式求值 (Evaluation)")
    class EvaluationTests {

        @Test
        @DisplayName("数值表达式按精确算术求值")
        void testEvaluate() {
            Expression sum = n.add(x);
            Expression call = f.call(n, n.add(1));

            assertAll(
                    () -> assertEquals(Rational.valueOf(9, 2), valuation.evaluate(sum)),
                    () -> assertEquals(Rational.valueOf(-3), valuation.evaluate(call)),
                    () -> assertEquals(BigInteger.valueOf(9), valuation.evaluate(n.power(2)))
            );
        }

        @Test
        @DisplayName("satisfies 检查 Bool 表达式")
        void testSatisfies() {
            assertAll(
                    () -> assertTrue(valuation.satisfies(n.gt(0))),
                    () -> assertTrue(valuation.satisfies(f.call(n, n.add(1)).eq(n.negate()))),
                    () -> assertTrue(valuation.satisfies(b.not())),
                    () -> assertFalse(valuation.satisfies(Expressions.and(b, n.gt(0)))),
                    () -> assertThrows(SortMismatchException.class, () -> valuation.satisfies(n.add(1)))
            );
        }

        @Test
        @DisplayName("除以 0 无法在本地求值")
        void testEvaluate_DivisionByZero_ShouldThrow() {
            assertAll(
                    () -> assertThrows(ArithmeticException.class, () -> valuation.evaluate(Expressions.mod(n, 0))),
                    () -> assertThrows(ArithmeticException.class, () -> valuation.evaluate(x.divide(0)))
            );
        }
    }
}
