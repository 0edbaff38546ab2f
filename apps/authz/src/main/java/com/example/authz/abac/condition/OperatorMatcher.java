package com.example.authz.abac.condition;

import com.example.authz.abac.model.EvaluationContext;

import java.util.List;

/**
 * Operator object: every clause must hold.
 */
public record OperatorMatcher(List<Clause> clauses) implements ConditionMatcher {

    /**
     * @param operator  Comparison to apply
     * @param operand   Right-hand value as written in the rule
     * @param reference Parsed operand for {@link ComparisonOperator#REF}, null otherwise or when unparseable
     */
    public record Clause(ComparisonOperator operator, Object operand, AttributePath reference) {}

    public OperatorMatcher {
        clauses = List.copyOf(clauses);
    }

    @Override
    public boolean matches(Object actual, EvaluationContext context) {
        for (Clause clause : clauses) {
            if (!holds(clause, actual, context)) {
                return false;
            }
        }
        return true;
    }

    private boolean holds(Clause clause, Object actual, EvaluationContext context) {
        if (clause.operator() == ComparisonOperator.REF) {
            if (clause.reference() == null) {
                return false;
            }
            return clause.operator().test(actual, context.resolve(clause.reference()));
        }
        return clause.operator().test(actual, clause.operand());
    }
}
