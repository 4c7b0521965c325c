/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.histogram;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongFunction;

/**
 * The built-in {@link BinDomain}s.
 */
final class Domains {

    static final BinDomain<Double> DOUBLES = new BinDomain<>() {
        @Override
        public Double add(Double left, Double right) {
            return left + right;
        }

        @Override
        public Double subtract(Double left, Double right) {
            return left - right;
        }

        @Override
        public double toDouble(Double value) {
            return value;
        }

        @Override
        public Double fromDouble(double value) {
            return value;
        }

        @Override
        public RoundingPolicy rounding() {
            return RoundingPolicy.EXACT;
        }
    };

    static final BinDomain<Float> FLOATS = new BinDomain<>() {
        @Override
        public Float add(Float left, Float right) {
            return left + right;
        }

        @Override
        public Float subtract(Float left, Float right) {
            return left - right;
        }

        @Override
        public double toDouble(Float value) {
            return value;
        }

        @Override
        public Float fromDouble(double value) {
            return (float) value;
        }

        @Override
        public RoundingPolicy rounding() {
            return RoundingPolicy.EXACT;
        }
    };

    static final BinDomain<Long> LONGS = new Integral<>(Long.class, Long.MIN_VALUE, Long.MAX_VALUE, Long::valueOf);

    static final BinDomain<Integer> INTEGERS = new Integral<>(Integer.class, Integer.MIN_VALUE, Integer.MAX_VALUE,
            value -> (int) value);

    static final BinDomain<Short> SHORTS = new Integral<>(Short.class, Short.MIN_VALUE, Short.MAX_VALUE,
            value -> (short) value);

    static final BinDomain<Byte> BYTES = new Integral<>(Byte.class, Byte.MIN_VALUE, Byte.MAX_VALUE,
            value -> (byte) value);

    static final BinDomain<BigDecimal> DECIMALS = new BinDomain<>() {
        @Override
        public BigDecimal add(BigDecimal left, BigDecimal right) {
            return left.add(right);
        }

        @Override
        public BigDecimal subtract(BigDecimal left, BigDecimal right) {
            return left.subtract(right);
        }

        @Override
        public double toDouble(BigDecimal value) {
            return value.doubleValue();
        }

        @Override
        public BigDecimal fromDouble(double value) {
            return BigDecimal.valueOf(value);
        }

        @Override
        public BigDecimal divide(BigDecimal value, int count) {
            return value.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64);
        }

        @Override
        public BigDecimal multiply(BigDecimal value, int count) {
            return value.multiply(BigDecimal.valueOf(count));
        }

        @Override
        public RoundingPolicy rounding() {
            return RoundingPolicy.EXACT;
        }

        @Override
        public String format(BigDecimal value) {
            return value.stripTrailingZeros().toPlainString();
        }
    };

    private Domains() {
    }

    /**
     * An integral domain. Arithmetic is carried out exactly on longs and narrowed back to the key
     * type; a result that does not fit fails with an {@link ArithmeticException}.
     */
    static final class Integral<T extends Number & Comparable<? super T>> implements BinDomain<T> {

        private final Class<T> type;
        private final long minimum;
        private final long maximum;
        private final LongFunction<T> narrowing;

        Integral(Class<T> type, long minimum, long maximum, LongFunction<T> narrowing) {
            this.type = type;
            this.minimum = minimum;
            this.maximum = maximum;
            this.narrowing = narrowing;
        }

        @Override
        public T add(T left, T right) {
            return narrow(Math.addExact(left.longValue(), right.longValue()));
        }

        @Override
        public T subtract(T left, T right) {
            return narrow(Math.subtractExact(left.longValue(), right.longValue()));
        }

        @Override
        public double toDouble(T value) {
            return value.doubleValue();
        }

        @Override
        public T fromDouble(double value) {
            if (Double.isNaN(value) || value < minimum || value > maximum) {
                throw new ArithmeticException(value + " does not fit in " + type.getSimpleName());
            }
            return narrow((long) Math.ceil(value));
        }

        @Override
        public RoundingPolicy rounding() {
            return RoundingPolicy.CEILING;
        }

        @Override
        public T divide(T value, int count) {
            return narrow(ceilDiv(value.longValue(), count));
        }

        @Override
        public T multiply(T value, int count) {
            return narrow(Math.multiplyExact(value.longValue(), count));
        }

        /**
         * Computes the edges on longs. Rounding the width up can carry the last edges past the
         * largest key of the type; those edges are capped at it, the last bin being inclusive.
         */
        @Override
        public List<T> edges(T min, T max, int bins) {
            long low = min.longValue();
            long high = max.longValue();
            long range;
            try {
                range = Math.subtractExact(high, low);
            }
            catch (ArithmeticException e) {
                throw new IllegalArgumentException(tooWide(min, max, bins), e);
            }
            if (range > Long.MAX_VALUE - bins) {
                throw new IllegalArgumentException(tooWide(min, max, bins));
            }

            long width = ceilDiv(range, bins);
            List<T> edges = new ArrayList<>(bins + 1);
            for (int i = 0; i <= bins; i++) {
                long beyond = width * i - range;
                edges.add(narrow(beyond > 0 && high > maximum - beyond ? maximum : high + beyond));
            }
            return edges;
        }

        private String tooWide(T min, T max, int bins) {
            return "Cannot split [" + min + ", " + max + "] into " + bins + " bins: the width overflows "
                    + type.getSimpleName();
        }

        private T narrow(long value) {
            if (value < minimum || value > maximum) {
                throw new ArithmeticException(value + " does not fit in " + type.getSimpleName());
            }
            return narrowing.apply(value);
        }

        private static long ceilDiv(long dividend, int divisor) {
            return Math.floorDiv(dividend, divisor) + (Math.floorMod(dividend, divisor) == 0 ? 0 : 1);
        }

        @Override
        public String toString() {
            return "Integral[" + type.getSimpleName() + "]";
        }
    }
}
