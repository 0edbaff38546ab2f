package com.example.authz.abac.condition;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.IntPredicate;

/**
 * Typed comparisons over loosely typed attribute values.
 * Numbers compare by value regardless of their boxed type; every other type uses
 * {@link Object#equals}. Ordering is only defined between two numbers.
 */
public final class AttributeValues {

    private AttributeValues() {}

    public static boolean equalTo(Object actual, Object expected) {
        if (actual == expected) {
            return true;
        }
        if (actual == null || expected == null) {
            return false;
        }
        if (actual instanceof Number left && expected instanceof Number right) {
            OptionalInt comparison = compareNumbers(left, right);
            return comparison.isPresent() && comparison.getAsInt() == 0;
        }
        return actual.equals(expected);
    }

    /**
     * Unmodifiable deep copy of a condition value. Maps keep their iteration order,
     * collections become lists, nulls are kept; scalars are returned as-is.
     */
    public static Object immutableCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(String.valueOf(key), immutableCopy(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object nested : collection) {
                copy.add(immutableCopy(nested));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public static boolean isCollection(Object value) {
        return value instanceof Collection<?>;
    }

    /**
     * Membership test. A non-collection container is a type mismatch and never contains anything.
     */
    public static boolean contains(Object container, Object value) {
        if (!(container instanceof Collection<?> collection)) {
            return false;
        }
        for (Object candidate : collection) {
            if (equalTo(value, candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Compare two values and test the sign of the result. Non-numeric or
     * non-finite operands fail the test.
     */
    public static boolean ordered(Object actual, Object expected, IntPredicate test) {
        if (!(actual instanceof Number left) || !(expected instanceof Number right)) {
            return false;
        }
        OptionalInt comparison = compareNumbers(left, right);
        return comparison.isPresent() && test.test(comparison.getAsInt());
    }

    private static OptionalInt compareNumbers(Number left, Number right) {
        BigDecimal l = toBigDecimal(left);
        BigDecimal r = toBigDecimal(right);
        if (l == null || r == null) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(l.compareTo(r));
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return null;
            }
            return BigDecimal.valueOf(value);
        }
        return BigDecimal.valueOf(number.longValue());
    }
}
