package org.easyz3.utils;

import com.microsoft.z3.Context;
import com.microsoft.z3.RatNum;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 精确有理数，始终以最简分数形式保存，分母恒为正。
 * 用作 Real 字面量和模型中 Real 取值的表示。
 */
public final class Rational implements Comparable<Rational> {
    private static final Logger logger = LoggerFactory.getLogger(Rational.class);
    // 只缓存分子分母都不超过该值的有理数，且总数不超过 MAX_CACHE_SIZE
    static final int MAX_CACHE_MAGNITUDE = 1024;
    static final int MAX_CACHE_SIZE = 4096;
    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(256);

    private static final BigInteger BIG_INT_ONE = BigInteger.ONE;
    private static final BigInteger BIG_INT_TEN = BigInteger.TEN;

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    // 常用常量
    public static final Rational ZERO = new Rational(BigInteger.ZERO, BIG_INT_ONE); // 0/1
    public static final Rational ONE = new Rational(BIG_INT_ONE, BIG_INT_ONE);      // 1/1
    public static final Rational HALF = new Rational(BIG_INT_ONE, BigInteger.valueOf(2)); // 1/2

    static {
        CACHE.put(ZERO.getCacheKey(), ZERO);
        CACHE.put(ONE.getCacheKey(), ONE);
        CACHE.put(HALF.getCacheKey(), HALF);
        for (int i = -16; i <= 16; i++) {
            if (i != 0 && i != 1) {
                Rational r = new Rational(BigInteger.valueOf(i), BIG_INT_ONE);
                CACHE.put(r.getCacheKey(), r);
            }
        }
    }

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
        logger.debug("创建了一个Rational: {} / {}", numerator, denominator);
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(BigInteger numerator) {
        return valueOf(numerator, BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator) {
        if (numerator == 0L) {
            return ZERO;
        }
        if (numerator == 1L) {
            return ONE;
        }
        return valueOf(BigInteger.valueOf(numerator), BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    /**
     * 由分子分母构造有理数，自动约分并把符号移到分子上。
     * @throws ArithmeticException 分母为 0
     */
    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "分子不能为 null");
        Objects.requireNonNull(denominator, "分母不能为 null");
        if (denominator.signum() == 0) {
            logger.error("尝试创建分母为 0 的Rational: {} / 0", numerator);
            throw new ArithmeticException("Rational 分母为 0: " + numerator + "/0");
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        if (numerator.equals(denominator)) {
            return ONE;
        }

        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BIG_INT_ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }

        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }
        Rational result = new Rational(numerator, denominator);
        if (shouldCache(result)) {
            CACHE.put(key, result);
        }
        return result;
    }

    /**
     * 按 double 的十进制字符串表示精确转换，0.1 得到 1/10 而不是二进制近似值。
     * @throws ArithmeticException NaN 或无穷
     */
    public static Rational valueOf(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            logger.error("无法将非有限 double 转换为Rational: {}", value);
            throw new ArithmeticException("非有限 double 不能转换为 Rational: " + value);
        }
        return valueOf(new BigDecimal(Double.toString(value)));
    }

    public static Rational valueOf(BigDecimal value) {
        int scale = value.scale();
        if (scale <= 0) {
            return valueOf(value.unscaledValue().multiply(BIG_INT_TEN.pow(-scale)), BIG_INT_ONE);
        }
        return valueOf(value.unscaledValue(), BIG_INT_TEN.pow(scale));
    }

    /**
     * 解析 "a/b"、整数或小数形式的字符串。
     */
    public static Rational valueOf(String s) {
        if (s == null || s.trim().isEmpty()) {
            throw new NumberFormatException("输入非法");
        }
        s = s.trim();

        if (s.contains("/")) {
            String[] parts = s.split("/", 2);
            if (parts[0].isEmpty() || parts[1].isEmpty()) {
                throw new NumberFormatException("无效分数格式: " + s);
            }
            try {
                BigInteger num = new BigInteger(parts[0].trim());
                BigInteger den = new BigInteger(parts[1].trim());
                return valueOf(num, den);
            } catch (NumberFormatException e) {
                throw new NumberFormatException("分数" + s + "的数字无效: " + e.getMessage());
            }
        }

        try {
            return valueOf(new BigDecimal(s));
        } catch (NumberFormatException e) {
            throw new NumberFormatException("无效数字格式: " + s);
        }
    }

    /**
     * 从 Z3 的有理数常量读取精确值。
     */
    public static Rational fromZ3(RatNum ratNum) {
        return valueOf(ratNum.getBigIntNumerator(), ratNum.getBigIntDenominator());
    }

    // ========== 基础运算 ==========
    public Rational add(Rational other) {
        if (this.isZero()) {
            return other;
        }
        if (other.isZero()) {
            return this;
        }
        BigInteger newNum = numerator.multiply(other.denominator).add(other.numerator.multiply(denominator));
        return valueOf(newNum, denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return this.add(other.negate());
    }

    public Rational multiply(Rational other) {
        if (this.isZero() || other.isZero()) {
            return ZERO;
        }
        return valueOf(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    /**
     * @throws ArithmeticException 除数为 0
     */
    public Rational divide(Rational other) {
        if (other.isZero()) {
            logger.error("Rational 除法的除数为 0: {} / 0", this);
            throw new ArithmeticException("除数为 0: " + this + " / 0");
        }
        if (other == ONE) {
            return this;
        }
        return valueOf(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    public Rational negate() {
        if (this.isZero()) {
            return ZERO;
        }
        return valueOf(numerator.negate(), denominator);
    }

    /**
     * 非负整数次幂。
     */
    public Rational pow(int exponent) {
        if (exponent < 0) {
            throw new ArithmeticException("指数不能为负: " + exponent);
        }
        return valueOf(numerator.pow(exponent), denominator.pow(exponent));
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public int signum() {
        return numerator.signum();
    }

    /**
     * 判断该rational是否是整数
     */
    public boolean isInteger() {
        return denominator.equals(BIG_INT_ONE);
    }

    /**
     * @throws ArithmeticException 不是整数
     */
    public BigInteger toBigIntegerExact() {
        if (!isInteger()) {
            throw new ArithmeticException("Rational 不是整数: " + this);
        }
        return numerator;
    }

    /**
     * 转换为 double 值，可能丢失精度。
     */
    public double doubleValue() {
        if (isZero()) {
            return 0.0;
        }
        int precision = Math.max(100, Math.max(numerator.abs().bitLength(), denominator.bitLength()) + 10);
        return new BigDecimal(numerator).divide(new BigDecimal(denominator), precision, RoundingMode.HALF_EVEN)
                .doubleValue();
    }

    public RatNum toZ3Real(Context ctx) {
        return ctx.mkReal(this.toString());
    }

    // ========== 对象基础方法 ==========

    @Override
    public int compareTo(Rational other) {
        BigInteger ad = this.numerator.multiply(other.denominator);
        BigInteger cb = other.numerator.multiply(this.denominator);
        return ad.compareTo(cb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rational that)) {
            return false;
        }
        return this.numerator.equals(that.numerator) && this.denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    private List<BigInteger> getCacheKey() {
        return List.of(numerator, denominator);
    }

    private static boolean shouldCache(Rational r) {
        if (CACHE.size() >= MAX_CACHE_SIZE) {
            return false;
        }
        BigInteger limit = BigInteger.valueOf(MAX_CACHE_MAGNITUDE);
        return r.numerator.abs().compareTo(limit) <= 0 && r.denominator.compareTo(limit) <= 0;
    }

    static int cacheSize() {
        return CACHE.size();
    }

    @Override
    public String toString() {
        if (isInteger()) {
            return numerator.toString();
        }
        return numerator + "/" + denominator;
    }
}
