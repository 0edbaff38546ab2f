package com.example.authz.abac.condition;

import java.util.Optional;

/**
 * Attribute buckets a condition path can address.
 */
public enum AttributeNamespace {
    USER("user"),
    RESOURCE("resource"),
    CONTEXT("context"),
    ACTION("action");

    private final String prefix;

    AttributeNamespace(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public static Optional<AttributeNamespace> fromPrefix(String prefix) {
        for (AttributeNamespace namespace : values()) {
            if (namespace.prefix.equals(prefix)) {
                return Optional.of(namespace);
            }
        }
        return Optional.empty();
    }
}
