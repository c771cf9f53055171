package com.campaignkeeper.validation;

import com.campaignkeeper.validation.FrontmatterSchema.FieldType;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FrontmatterSchemaTest {

    private final FrontmatterSchema schema = new FrontmatterSchema()
        .required("name")
        .field("name", FieldType.STRING)
        .field("hidden", FieldType.BOOLEAN)
        .field("tags", FieldType.STRING_LIST)
        .field("population", FieldType.NUMBER)
        .oneOf("type", "world", "faction", "history");

    @Test
    void acceptsValidFrontmatter() {
        Map<String, Object> fm = Map.of(
            "name", "The Sundering",
            "type", "history",
            "hidden", true,
            "tags", List.of("war"),
            "population", 12,
            "anythingElse", "is fine");

        assertTrue(schema.validate(fm).isValid());
    }

    @Test
    void reportsEveryViolation() {
        Map<String, Object> fm = new HashMap<>();
        fm.put("name", "  ");
        fm.put("hidden", "yes");
        fm.put("tags", List.of("ok", 3));
        fm.put("type", "gossip");

        ValidationResult result = schema.validate(fm);

        assertFalse(result.isValid());
        assertEquals(List.of(
            "name: is required",
            "hidden: expected boolean",
            "tags: expected string list",
            "type: must be one of world, faction, history"), result.getErrors());
    }

    @Test
    void throwIfInvalidCarriesDetails() {
        ValidationResult result = schema.validate(Map.of("population", "many"));

        ContentValidationException e = assertThrows(ContentValidationException.class, result::throwIfInvalid);
        assertEquals(2, e.getDetails().size());
        assertEquals("Validation failed", e.getMessage());
    }

    @Test
    void permissiveSchemaAcceptsAnything() {
        assertTrue(FrontmatterSchema.permissive().validate(Map.of("x", List.of(1, 2))).isValid());
        assertTrue(FrontmatterSchema.permissive().validate(null).isValid());
    }
}
