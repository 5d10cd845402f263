package com.fourpaws.backend.modules.annotation.domain;

/**
 * Entities a note or photo can be attached to.
 */
public enum SubjectType {
    ANIMAL,
    PERSON,
    APPLICATION,
    MEDICAL_TASK,
    FOSTER_ASSIGNMENT,
    ADOPTION
}
