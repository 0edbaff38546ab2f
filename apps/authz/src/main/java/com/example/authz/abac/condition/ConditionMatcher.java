package com.example.authz.abac.condition;

import com.example.authz.abac.model.EvaluationContext;

/**
 * Compares a resolved attribute value against a condition's expected value.
 */
public interface ConditionMatcher {

    boolean matches(Object actual, EvaluationContext context);
}
