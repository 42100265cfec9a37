package org.easyz3.expressions;

import org.easyz3.core.DeclarationRegistry;
import org.easyz3.core.Sort;
import org.easyz3.exceptions.InvalidArityException;
import org.easyz3.exceptions.InvalidOperandException;
import org.easyz3.exceptions.SortMismatchException;
import org.easyz3.utils.Rational;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.function.BinaryOperator;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ExpressionsTest {

    private Ref n;
    private Ref x;
    private Ref b;
    private Ref f;

    @BeforeAll
    void setUp() {
        DeclarationRegistry registry = new DeclarationRegistry();
        n = Expressions.ref(registry.declare("n", Sort.INT));
        x = Expressions.ref(registry.declare("x", Sort.REAL));
        b = Expressions.ref(registry.declare("b", Sort.BOOL));
        f = Expressions.ref(registry.declare("f", Sort.function(Sort.REAL, Sort.INT, Sort.INT)));
    }

    @Nested
    @DisplayName("字面量 (Literals)")
    class LiteralTests {

        @Test
        @DisplayName("由 Java 类型推断 sort")
        void testLiteral_ShouldInferSort() {
            assertAll(
                    () -> assertEquals(Sort.BOOL, Expressions.literal(true).getSort()),
                    () -> assertEquals(Sort.INT, Expressions.literal(1).getSort()),
                    () -> assertEquals(Sort.INT, Expressions.literal(1L).getSort()),
                    () -> assertEquals(Sort.INT, Expressions.literal(BigInteger.TEN).getSort()),
                    () -> assertEquals(Sort.REAL, Expressions.literal(1.5).getSort()),
                    () -> assertEquals(Sort.REAL, Expressions.literal(new BigDecimal("0.1")).getSort()),
                    () -> assertEquals(Sort.REAL, Expressions.literal(Rational.HALF).getSort()),
                    () -> assertEquals(Rational.valueOf(1, 10), Expressions.literal(0.1).getValue()),
                    () -> assertSame(Expressions.TRUE, Expressions.literal(true))
            );
        }

        @Test
        @DisplayName("不支持的值应抛出 InvalidOperandException")
        void testLiteral_Unsupported_ShouldThrow() {
            assertAll(
                    () -> assertThrows(InvalidOperandException.class, () -> Expressions.literal("1")),
                    () -> assertThrows(InvalidOperandException.class, () -> Expressions.literal(null)),
                    () -> assertThrows(InvalidOperandException.class, () -> Expressions.literal(Double.NaN)),
                    () -> assertThrows(InvalidOperandException.class, () -> Expressions.literal(Float.NEGATIVE_INFINITY))
            );
        }
    }

    @Nested
    @DisplayName("类型规则 (Sort Rules)")
    class SortRuleTests {

        @Test
        @DisplayName("Int 与 Real 混合运算提升为 Real")
        void testArithmetic_IntRealPromotion() {
            assertAll(
                    () -> assertEquals(Sort.INT, n.add(1).getSort()),
                    () -> assertEquals(Sort.REAL, n.add(x).getSort()),
                    () -> assertEquals(Sort.REAL, n.multiply(0.5).getSort()),
                    () -> assertEquals(Sort.REAL, n.divide(2.0).getSort()),
                    () -> assertEquals(Sort.REAL, x.divide(2).getSort()),
                    () -> assertEquals(Sort.INT, n.divide(2).getSort()),
                    () -> assertEquals(Sort.INT, Expressions.intDivide(n, 2).getSort()),
                    () -> assertEquals(Sort.INT, n.negate().getSort()),
                    () -> assertEquals(Sort.BOOL, n.lt(x).getSort())
            );
        }

        @Test
        @DisplayName("Bool 与数值混合的每一种算术运算都应抛出 SortMismatchException")
        void testArithmetic_BoolWithNumeric_ShouldThrow() {
            List<BinaryOperator<Object>> ops = List.of(
                    Expressions::add, Expressions::subtract, Expressions::multiply, Expressions::divide,
                    Expressions::intDivide, Expressions::mod);
            for (BinaryOperator<Object> op : ops) {
                assertAll(
                        () -> assertThrows(SortMismatchException.class, () -> op.apply(b, n)),
                        () -> assertThrows(SortMismatchException.class, () -> op.apply(x, b)),
                        () -> assertThrows(SortMismatchException.class, () -> op.apply(true, 1)),
                        () -> assertThrows(SortMismatchException.class, () -> op.apply(b, b))
                );
            }
        }

        @Test
        @DisplayName("div/mod 只接受 Int")
        void testIntegerOnlyOps_WithReal_ShouldThrow() {
            assertAll(
                    () -> assertThrows(SortMismatchException.class, () -> Expressions.intDivide(x, 2)),
                    () -> assertThrows(SortMismatchException.class, () -> Expressions.mod(n, 0.5))
            );
        }

        @Test
        @DisplayName("比较：Bool 只能做相等比较，不能与数值比较")
        void testCompare() {
            assertAll(
                    () -> assertEquals(Sort.BOOL, b.eq(true).getSort()),
                    () -> assertEquals(Sort.BOOL, b.ne(Expressions.FALSE).getSort()),
                    () -> assertThrows(SortMismatchException.class, () -> b.lt(true)),
                    () -> assertThrows(SortMismatchException.class, () -> b.eq(1)),
                    () -> assertThrows(SortMismatchException.class, () -> n.ge(b))
            );
        }

        @Test
        @DisplayName("布尔连接词只接受 Bool")
        void testConnectives() {
            assertAll(
                    () -> assertEquals(Sort.BOOL, b.and(n.gt(0)).getSort()),
                    () -> assertEquals(Sort.BOOL, Expressions.or(b, false, n.eq(2)).getSort()),
                    () -> assertEquals(Sort.BOOL, b.implies(n.eq(2)).getSort()),
                    () -> assertThrows(SortMismatchException.class, () -> b.and(n)),
                    () -> assertThrows(SortMismatchException.class, () -> n.not()),
                    () -> assertThrows(SortMismatchException.class, () -> Expressions.implies(1, b)),
                    () -> assertThrows(SortMismatchException.class, () -> x.negate().or(b))
            );
        }

        @Test
        @DisplayName("连接词操作数个数")
        void testConnectives_Arity() {
            assertAll(
                    () -> assertThrows(InvalidArityException.class, () -> Expressions.and(List.of(b))),
                    () -> assertThrows(InvalidArityException.class, () -> Expressions.or(List.of())),
                    () -> assertEquals(2, ((BoolOp) b.xor(n.gt(0))).getOperands().size()),
                    () -> assertEquals(3, ((BoolOp) Expressions.and(List.of(b, true, n.gt(1)))).getOperands().size())
            );
        }
    }

    @Nested
    @DisplayName("函数调用 (Calls)")
    class CallTests {

        @Test
        @DisplayName("合法调用的 sort 为值域")
        void testCall() {
            Expression call = f.call(n, n.add(1));

            assertAll(
                    () -> assertEquals(Sort.REAL, call.getSort()),
                    () -> assertEquals("f(n, (n + 1))", call.toString())
            );
        }

        @Test
        @DisplayName("参数个数错误应抛出 InvalidArityException")
        void testCall_WrongArity_ShouldThrow() {
            assertAll(
                    () -> assertThrows(InvalidArityException.class, () -> f.call(n)),
                    () -> assertThrows(InvalidArityException.class, () -> f.call(1, 2, 3))
            );
        }

        @Test
        @DisplayName("参数 sort 错误或被调用者不是函数应抛出 SortMismatchException")
        void testCall_WrongSort_ShouldThrow() {
            assertAll(
                    () -> assertThrows(SortMismatchException.class, () -> f.call(n, x)),
                    () -> assertThrows(SortMismatchException.class, () -> f.call(b, 1)),
                    () -> assertThrows(SortMismatchException.class, () -> n.call(1))
            );
        }
    }

    @Nested
    @DisplayName("幂运算 (Power)")
    class PowerTests {

        @Test
        @DisplayName("指数为非负整数字面量")
        void testPower() {
            assertAll(
                    () -> assertEquals(Sort.INT, n.power(3).getSort()),
                    () -> assertEquals(Sort.REAL, x.power(Expressions.intLiteral(2)).getSort()),
                    () -> assertEquals(Sort.INT, n.power(0).getSort()),
                    () -> assertEquals(Sort.INT, n.power(Expressions.MAX_POWER_EXPONENT).getSort())
            );
        }

        @Test
        @DisplayName("非法指数应抛出 InvalidOperandException")
        void testPower_InvalidExponent_ShouldThrow() {
            assertAll(
                    () -> assertThrows(InvalidOperandException.class, () -> n.power(-1)),
                    () -> assertThrows(InvalidOperandException.class, () -> n.power(n)),
                    () -> assertThrows(InvalidOperandException.class, () -> n.power(0.5)),
                    () -> assertThrows(InvalidOperandException.class, () -> n.power(BigInteger.ONE.shiftLeft(40))),
                    () -> assertThrows(InvalidOperandException.class, () -> n.power(Expressions.MAX_POWER_EXPONENT + 1)),
                    () -> assertThrows(InvalidOperandException.class, () -> x.power(1_500_000_000)),
                    () -> assertThrows(SortMismatchException.class, () -> b.power(2))
            );
        }
    }

    @Nested
    @DisplayName("结构相等与纯函数性 (Structural Equality)")
    class EqualityTests {

        @Test
        @DisplayName("相同输入构造出结构相等的节点")
        void testConstruction_IsPure() {
            Expression first = Expressions.and(n.gt(0), f.call(n, n.add(1)).eq(x.multiply(-2)));
            Expression second = Expressions.and(n.gt(0), f.call(n, n.add(1)).eq(x.multiply(-2)));

            assertAll(
                    () -> assertEquals(first, second),
                    () -> assertEquals(first.hashCode(), second.hashCode()),
                    () -> assertNotEquals(n.add(1), n.add(2)),
                    () -> assertNotEquals(Expressions.literal(1), Expressions.literal(1.0))
            );
        }

        @Test
        @DisplayName("impliedBy 是反向的 implies")
        void testImpliedBy() {
            assertEquals(Expressions.implies(n.gt(0), b), Expressions.impliedBy(b, n.gt(0)));
        }

        @Test
        @DisplayName("链式方法与工厂方法构造出相同的节点")
        void testFluentMethods_MatchFactories() {
            assertAll(
                    () -> assertEquals(Expressions.intDivide(n, 3), n.intDivide(3)),
                    () -> assertEquals(Expressions.mod(n, 3), n.mod(3)),
                    () -> assertEquals(Expressions.plus(x), x.plus()),
                    () -> assertEquals(Expressions.impliedBy(b, n.gt(0)), b.impliedBy(n.gt(0))),
                    () -> assertEquals(Sort.INT, n.mod(3).getSort()),
                    () -> assertThrows(SortMismatchException.class, () -> x.mod(3)),
                    () -> assertThrows(SortMismatchException.class, () -> b.plus())
            );
        }

        @Test
        @DisplayName("toString 以中缀形式输出")
        void testToString() {
            assertAll(
                    () -> assertEquals("((n + 1) > 0)", n.add(1).gt(0).toString()),
                    () -> assertEquals("(b => (n == 2))", b.implies(n.eq(2)).toString()),
                    () -> assertEquals("(!b)", b.not().toString())
            );
        }
    }
}
