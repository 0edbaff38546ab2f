package com.example.authz.abac.condition;

import com.example.authz.abac.model.EvaluationContext;

/**
 * Exact equality. A string that looks like a path ({@code "user.id"}) is still a
 * literal and is never resolved; use {@code {"$ref": "user.id"}} for that.
 */
public record LiteralMatcher(Object expected) implements ConditionMatcher {

    @Override
    public boolean matches(Object actual, EvaluationContext context) {
        return AttributeValues.equalTo(actual, expected);
    }
}
