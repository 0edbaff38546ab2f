package com.example.authz.abac.condition;

import com.example.authz.abac.model.EvaluationContext;

import java.util.List;

public record MembershipMatcher(List<Object> expected) implements ConditionMatcher {

    @Override
    public boolean matches(Object actual, EvaluationContext context) {
        return AttributeValues.contains(expected, actual);
    }
}
