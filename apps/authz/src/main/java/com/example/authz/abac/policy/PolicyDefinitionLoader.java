package com.example.authz.abac.policy;

import com.example.authz.abac.exception.InvalidPolicyException;
import com.example.authz.abac.model.PolicyRule;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads policy rules from a YAML (or JSON) document.
 *
 * <p>Condition keys such as {@code context.hour} and operator keys such as {@code $gte}
 * are kept verbatim, which is why policies are not bound through Spring properties.
 */
@Slf4j
public class PolicyDefinitionLoader {

    private final ObjectMapper yamlMapper;
    private final Validator validator;

    public PolicyDefinitionLoader(Validator validator) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.validator = validator;
    }

    /**
     * Load every rule in the document.
     *
     * @throws IllegalStateException  if the resource cannot be read or parsed
     * @throws InvalidPolicyException if a definition is incomplete or malformed
     */
    public List<PolicyRule> load(Resource resource) {
        PolicyDocument document;
        try (InputStream inputStream = resource.getInputStream()) {
            document = yamlMapper.readValue(inputStream, PolicyDocument.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load policy document: " + resource.getDescription(), e);
        }

        if (document == null) {
            log.warn("Policy document {} is empty", resource.getDescription());
            return List.of();
        }

        Set<ConstraintViolation<PolicyDocument>> violations = validator.validate(document);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new InvalidPolicyException(null, "Invalid policy document " + resource.getDescription() + ": " + details);
        }

        List<PolicyRule> rules = document.policies().stream()
                .map(PolicyDefinition::toRule)
                .toList();
        log.info("Loaded {} policies from {}", rules.size(), resource.getDescription());
        return rules;
    }
}
