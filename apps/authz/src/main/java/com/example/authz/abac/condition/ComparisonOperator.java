package com.example.authz.abac.condition;

import java.util.List;
import java.util.function.BiPredicate;

/**
 * Operators accepted inside an operator object, e.g. {@code {"$gte": 9, "$lte": 17}}.
 *
 * <p>{@link #REF} compares against another attribute path ({@code {"$ref": "user.id"}});
 * its operand is resolved by {@link OperatorMatcher} before the test runs.
 * {@link #UNKNOWN} stands for any unrecognised key and never holds.
 */
public enum ComparisonOperator {
    EQ(AttributeValues::equalTo, "$eq", "="),
    NE((actual, operand) -> !AttributeValues.equalTo(actual, operand), "$ne", "!="),
    IN((actual, operand) -> AttributeValues.contains(operand, actual), "$in"),
    NOT_IN((actual, operand) -> AttributeValues.isCollection(operand)
            && !AttributeValues.contains(operand, actual), "$nin", "$not_in"),
    GTE((actual, operand) -> AttributeValues.ordered(actual, operand, c -> c >= 0), "$gte", ">="),
    LTE((actual, operand) -> AttributeValues.ordered(actual, operand, c -> c <= 0), "$lte", "<="),
    GT((actual, operand) -> AttributeValues.ordered(actual, operand, c -> c > 0), "$gt", ">"),
    LT((actual, operand) -> AttributeValues.ordered(actual, operand, c -> c < 0), "$lt", "<"),
    REF(AttributeValues::equalTo, "$ref"),
    UNKNOWN((actual, operand) -> false);

    private final BiPredicate<Object, Object> test;
    private final List<String> keys;

    ComparisonOperator(BiPredicate<Object, Object> test, String... keys) {
        this.test = test;
        this.keys = List.of(keys);
    }

    public List<String> getKeys() {
        return keys;
    }

    public boolean test(Object actual, Object operand) {
        return test.test(actual, operand);
    }

    /**
     * Look up an operator by key. Never fails; unrecognised keys map to {@link #UNKNOWN}.
     */
    public static ComparisonOperator fromKey(String key) {
        if (key != null) {
            for (ComparisonOperator operator : values()) {
                if (operator.keys.contains(key)) {
                    return operator;
                }
            }
        }
        return UNKNOWN;
    }
}
