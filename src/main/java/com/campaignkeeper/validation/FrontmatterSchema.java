package com.campaignkeeper.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Data-driven frontmatter rules for one module. Fields without a rule are
 * accepted as-is; absent optional fields always pass.
 */
public class FrontmatterSchema {

    public enum FieldType {
        STRING, NUMBER, BOOLEAN, STRING_LIST;

        boolean accepts(Object value) {
            switch (this) {
                case STRING:
                    return value instanceof String;
                case NUMBER:
                    return value instanceof Number;
                case BOOLEAN:
                    return value instanceof Boolean;
                case STRING_LIST:
                    if (!(value instanceof Collection)) {
                        return false;
                    }
                    for (Object item : (Collection<?>) value) {
                        if (!(item instanceof String)) {
                            return false;
                        }
                    }
                    return true;
                default:
                    return false;
            }
        }

        String label() {
            return name().toLowerCase().replace('_', ' ');
        }
    }

    private final Set<String> required = new LinkedHashSet<>();
    private final Map<String, FieldType> types = new LinkedHashMap<>();
    private final Map<String, Set<String>> allowedValues = new LinkedHashMap<>();

    public static FrontmatterSchema permissive() {
        return new FrontmatterSchema();
    }

    public FrontmatterSchema required(String field) {
        required.add(field);
        return this;
    }

    public FrontmatterSchema field(String field, FieldType type) {
        types.put(field, type);
        return this;
    }

    public FrontmatterSchema oneOf(String field, String... values) {
        allowedValues.put(field, new LinkedHashSet<>(List.of(values)));
        return this;
    }

    public ValidationResult validate(Map<String, Object> frontmatter) {
        List<String> errors = new ArrayList<>();
        Map<String, Object> fm = frontmatter != null ? frontmatter : Map.of();

        for (String field : required) {
            Object value = fm.get(field);
            if (value == null || (value instanceof String && ((String) value).isBlank())) {
                errors.add(field + ": is required");
            }
        }

        for (Map.Entry<String, FieldType> rule : types.entrySet()) {
            Object value = fm.get(rule.getKey());
            if (value != null && !rule.getValue().accepts(value)) {
                errors.add(rule.getKey() + ": expected " + rule.getValue().label());
            }
        }

        for (Map.Entry<String, Set<String>> rule : allowedValues.entrySet()) {
            Object value = fm.get(rule.getKey());
            if (value != null && !rule.getValue().contains(String.valueOf(value))) {
                errors.add(rule.getKey() + ": must be one of " + String.join(", ", rule.getValue()));
            }
        }

        return ValidationResult.of(errors);
    }
}
