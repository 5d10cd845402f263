package com.fourpaws.backend.support;

import java.util.UUID;

import org.springframework.test.util.ReflectionTestUtils;

/**
 * Unit tests build entities without a persistence context, so generated ids are assigned here.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static <T> T withId(T entity, UUID id) {
        ReflectionTestUtils.setField(entity, "id", id);
        return entity;
    }

    public static <T> T withVersion(T entity, long version) {
        ReflectionTestUtils.setField(entity, "version", version);
        return entity;
    }
}
