package com.github.rudygunawan.memo.key;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Builds cache keys from the positional and keyword arguments of a memoized call.
 *
 * <p>Keys are as flat as possible: positional values, then a private marker followed by the keyword
 * names and values sorted by name, then (in typed mode) the runtime class of every value. An untyped
 * call with a single integral number, {@link String} or {@code null} argument and no keyword
 * arguments uses that argument itself as the key, integral numbers in their {@link Long} form.
 *
 * <p>In untyped mode numeric arguments are compared by value, so {@code 3}, {@code 3L} and
 * {@code 3.0} produce the same key. In typed mode they produce three different keys.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class KeyBuilder {

    private static final Object KWD_MARK = new Object() {
        @Override
        public String toString() {
            return "<kwargs>";
        }
    };

    // Checked after normalize, which has already widened Integer, Short and Byte to Long.
    private static final Set<Class<?>> FAST_TYPES = Set.of(Long.class, String.class);

    private static final double TWO_POW_63 = 0x1p63;

    // Integer digits of Long.MAX_VALUE.
    private static final int LONG_DIGITS = 19;

    private final boolean typed;

    public KeyBuilder(boolean typed) {
        this.typed = typed;
    }

    public boolean isTyped() {
        return typed;
    }

    /**
     * Returns the key for a call.
     *
     * @param args positional arguments, {@code null} meaning none
     * @param kwargs keyword arguments, {@code null} meaning none
     * @return a key with stable {@code equals} and {@code hashCode}
     * @throws UnhashableArgumentException if any argument is an array
     */
    public Object build(List<?> args, Map<String, ?> kwargs) {
        List<?> positional = (args == null) ? List.of() : args;
        int argCount = positional.size();
        boolean hasKwargs = kwargs != null && !kwargs.isEmpty();

        if (!typed && !hasKwargs && argCount == 1) {
            Object only = normalize(checkHashable(positional.get(0), 0, null));
            if (only == null || FAST_TYPES.contains(only.getClass())) {
                return only;
            }
            return new CompositeKey(new Object[] {only});
        }

        SortedMap<String, Object> sorted = hasKwargs ? new TreeMap<String, Object>(kwargs) : null;
        int kwargCount = hasKwargs ? sorted.size() : 0;
        int length = argCount + (hasKwargs ? 1 + 2 * kwargCount : 0);
        if (typed) {
            length += argCount + kwargCount;
        }

        Object[] parts = new Object[length];
        int i = 0;
        for (int a = 0; a < argCount; a++) {
            parts[i++] = valueOf(positional.get(a), a, null);
        }
        if (hasKwargs) {
            parts[i++] = KWD_MARK;
            for (Map.Entry<String, Object> entry : sorted.entrySet()) {
                parts[i++] = entry.getKey();
                parts[i++] = valueOf(entry.getValue(), -1, entry.getKey());
            }
        }
        if (typed) {
            for (Object value : positional) {
                parts[i++] = typeOf(value);
            }
            if (hasKwargs) {
                for (Object value : sorted.values()) {
                    parts[i++] = typeOf(value);
                }
            }
        }
        return new CompositeKey(parts);
    }

    private Object valueOf(Object value, int index, String keyword) {
        checkHashable(value, index, keyword);
        return typed ? value : normalize(value);
    }

    /**
     * Rejects arrays. The position is either a positional {@code index} or, when {@code keyword} is
     * non-null, a keyword name.
     */
    private static Object checkHashable(Object value, int index, String keyword) {
        if (value != null && value.getClass().isArray()) {
            String position = (keyword == null) ? "args[" + index + "]" : "kwargs[" + keyword + "]";
            throw new UnhashableArgumentException(value, position);
        }
        return value;
    }

    private static Class<?> typeOf(Object value) {
        return (value == null) ? Void.class : value.getClass();
    }

    /**
     * Maps numbers that are equal in value onto one representation: integral values that fit a
     * {@code long} become {@link Long}, other floating point values become {@link Double}. A
     * {@link BigDecimal} with more integer digits than a {@code long} holds stays a stripped
     * {@link BigDecimal} so that huge exponents are never expanded.
     */
    static Object normalize(Object value) {
        if (value instanceof Long) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && d >= -TWO_POW_63 && d < TWO_POW_63) {
                return (long) d;
            }
            return d;
        }
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            return (big.bitLength() < Long.SIZE) ? (Object) big.longValue() : big;
        }
        if (value instanceof BigDecimal) {
            BigDecimal decimal = ((BigDecimal) value).stripTrailingZeros();
            if (decimal.scale() > 0 || decimal.precision() - decimal.scale() > LONG_DIGITS) {
                return decimal;
            }
            BigInteger integral = decimal.toBigIntegerExact();
            return (integral.bitLength() < Long.SIZE) ? (Object) integral.longValue() : decimal;
        }
        return value;
    }
}
