package com.fourpaws.backend.global.attribute;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;

import org.junit.jupiter.api.Test;

class AttributeSchemaTest {

    private final AttributeSchema open = AttributeSchema.open("attributes");
    private final AttributeSchema flags = AttributeSchema.closed("flags",
            Map.of("doNotAdopt", AttributeKind.BOOLEAN, "maxCapacity", AttributeKind.INTEGER));

    @Test
    void openSchemaAcceptsScalarsAndFlatLists() {
        Map<String, Object> result = open.validate(Map.of(
                "color", "tabby", "weightKg", 4.2, "vaccinated", true, "tags", List.of("shy", 3)));

        assertThat(result).containsEntry("color", "tabby").containsEntry("tags", List.of("shy", 3));
    }

    @Test
    void nestedObjectsAreRejected() {
        assertInvalid(() -> open.validate(Map.of("owner", Map.of("name", "x"))));
        assertInvalid(() -> open.validate(Map.of("history", List.of(Map.of("a", 1)))));
    }

    @Test
    void keysMustStartWithALetter() {
        assertInvalid(() -> open.validate(Map.of("1st", "x")));
        assertInvalid(() -> open.validate(Map.of("has space", "x")));
    }

    @Test
    void nullValuesAreDropped() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("note", null);
        raw.put("size", "small");

        assertThat(open.validate(raw)).containsOnlyKeys("size");
        assertThat(open.validate(null)).isEmpty();
    }

    @Test
    void closedSchemaChecksKeysAndKinds() {
        assertThat(flags.validate(Map.of("doNotAdopt", true, "maxCapacity", 2)))
                .containsEntry("maxCapacity", 2);
        assertInvalid(() -> flags.validate(Map.of("favouriteColour", "red")));
        assertInvalid(() -> flags.validate(Map.of("doNotAdopt", "yes")));
        assertInvalid(() -> flags.validate(Map.of("maxCapacity", 2.5)));
    }

    private static void assertInvalid(org.assertj.core.api.ThrowableAssert.ThrowingCallable call) {
        assertThatThrownBy(call)
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.INVALID_ATTRIBUTES)).isTrue());
    }
}
