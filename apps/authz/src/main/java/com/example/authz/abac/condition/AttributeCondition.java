package com.example.authz.abac.condition;

import com.example.authz.abac.model.EvaluationContext;

/**
 * One compiled {@code path -> expected} entry of a rule.
 *
 * @param key     Condition key as written in the rule
 * @param path    Parsed path, null when the key is not a {@code namespace.field} path
 * @param matcher Comparison against the resolved value
 */
public record AttributeCondition(String key, AttributePath path, ConditionMatcher matcher) {

    /**
     * Keys that do not parse as a path are skipped and hold vacuously.
     */
    public boolean isSkipped() {
        return path == null;
    }

    public boolean test(EvaluationContext context) {
        if (isSkipped()) {
            return true;
        }
        return matcher.matches(context.resolve(path), context);
    }
}
