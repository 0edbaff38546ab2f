package com.example.authz.abac.condition;

import java.util.Optional;

/**
 * Dotted attribute reference such as {@code resource.owner_id}.
 *
 * @param namespace Bucket the attribute lives in
 * @param field     Key inside the bucket; everything after the first dot, looked up as-is
 */
public record AttributePath(AttributeNamespace namespace, String field) {

    /**
     * Split on the first dot. Paths without a dot or with an unknown namespace
     * yield an empty result.
     */
    public static Optional<AttributePath> parse(String path) {
        if (path == null) {
            return Optional.empty();
        }
        int dot = path.indexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        String prefix = path.substring(0, dot);
        String field = path.substring(dot + 1);
        return AttributeNamespace.fromPrefix(prefix)
                .map(namespace -> new AttributePath(namespace, field));
    }

    @Override
    public String toString() {
        return namespace.getPrefix() + "." + field;
    }
}
