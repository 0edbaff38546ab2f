package com.example.authz.abac.condition;

import com.example.authz.abac.model.EvaluationContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Compiled conditions of a policy rule, evaluated as a logical AND.
 *
 * <p>Expected values compile by shape: a map is an operator object, a collection is a
 * membership test, anything else is a literal. Evaluation never throws; a fault
 * inside a comparison counts as a failed condition.
 */
@Slf4j
public final class ConditionSet {

    private static final ConditionSet EMPTY = new ConditionSet(List.of());

    private final List<AttributeCondition> conditions;

    private ConditionSet(List<AttributeCondition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    public static ConditionSet compile(Map<String, Object> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return EMPTY;
        }

        List<AttributeCondition> compiled = new ArrayList<>(conditions.size());
        for (Map.Entry<String, Object> entry : conditions.entrySet()) {
            String key = entry.getKey();
            AttributePath path = AttributePath.parse(key).orElse(null);
            if (path == null) {
                log.debug("Condition key '{}' is not a namespace.field path - skipping", key);
            }
            compiled.add(new AttributeCondition(key, path, compileMatcher(entry.getValue())));
        }
        return new ConditionSet(compiled);
    }

    public List<AttributeCondition> getConditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    /**
     * Check that every condition holds for the request.
     */
    public boolean matches(EvaluationContext context) {
        for (AttributeCondition condition : conditions) {
            boolean holds;
            try {
                holds = condition.test(context);
            } catch (RuntimeException e) {
                log.warn("Condition '{}' failed to evaluate, treating as false: {}",
                        condition.key(), e.getMessage());
                holds = false;
            }
            if (!holds) {
                log.trace("Condition '{}' did not hold", condition.key());
                return false;
            }
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    private static ConditionMatcher compileMatcher(Object expected) {
        if (expected instanceof Map<?, ?> operators) {
            List<OperatorMatcher.Clause> clauses = new ArrayList<>(operators.size());
            for (Map.Entry<?, ?> entry : operators.entrySet()) {
                String key = String.valueOf(entry.getKey());
                ComparisonOperator operator = ComparisonOperator.fromKey(key);
                if (operator == ComparisonOperator.UNKNOWN) {
                    log.warn("Unknown condition operator '{}' - condition will never hold", key);
                }
                AttributePath reference = operator == ComparisonOperator.REF && entry.getValue() instanceof String ref
                        ? AttributePath.parse(ref).orElse(null)
                        : null;
                clauses.add(new OperatorMatcher.Clause(
                        operator, AttributeValues.immutableCopy(entry.getValue()), reference));
            }
            return new OperatorMatcher(clauses);
        }
        if (expected instanceof Collection<?> values) {
            return new MembershipMatcher((List<Object>) AttributeValues.immutableCopy(values));
        }
        return new LiteralMatcher(expected);
    }
}
