package com.example.authz.abac.model;

import com.example.authz.abac.condition.AttributePath;
import com.example.authz.rbac.model.Role;

import java.util.List;
import java.util.Map;

/**
 * Attributes of a single access request. Lives for the duration of one evaluation.
 *
 * @param user     Subject attributes; {@code roles} holds the subject's role strings
 * @param resource Resource attributes such as {@code owner_id}, {@code region}, {@code data_classification}
 * @param action   Requested action, e.g. {@code "claim:view"}
 * @param context  Request context such as {@code hour}, {@code day_of_week}, {@code ip}
 */
public record EvaluationContext(
        Map<String, Object> user,
        Map<String, Object> resource,
        String action,
        Map<String, Object> context
) {
    public static final String ROLES_ATTRIBUTE = "roles";
    public static final String ACTION_ATTRIBUTE = "action";
    public static final String RESOURCE_TYPE_ATTRIBUTE = "type";
    public static final String RESOURCE_ID_ATTRIBUTE = "id";

    public EvaluationContext {
        user = user == null ? Map.of() : user;
        resource = resource == null ? Map.of() : resource;
        context = context == null ? Map.of() : context;
    }

    public List<Role> roles() {
        return Role.resolveAll(user.get(ROLES_ATTRIBUTE));
    }

    /**
     * Resolve an attribute path. The {@code action} namespace reads
     * {@code context["action"]}; the requested action is not injected there.
     */
    public Object resolve(AttributePath path) {
        return switch (path.namespace()) {
            case USER -> user.get(path.field());
            case RESOURCE -> resource.get(path.field());
            case CONTEXT -> context.get(path.field());
            case ACTION -> context.get(ACTION_ATTRIBUTE);
        };
    }

    /**
     * Resource key in {@code "<type>/<id>"} form, or null when the type is absent.
     */
    public String resourceKey() {
        Object type = resource.get(RESOURCE_TYPE_ATTRIBUTE);
        if (type == null) {
            return null;
        }
        Object id = resource.get(RESOURCE_ID_ATTRIBUTE);
        return id == null ? type + "/" : type + "/" + id;
    }
}
