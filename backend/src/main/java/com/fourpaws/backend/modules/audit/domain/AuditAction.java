package com.fourpaws.backend.modules.audit.domain;

public enum AuditAction {
    ORGANIZATION_CREATED,
    MEMBER_ADDED,
    MEMBER_ROLE_CHANGED,
    MEMBER_REMOVED,
    ANIMAL_INTAKE,
    ANIMAL_UPDATED,
    ANIMAL_STATUS_CHANGED,
    OUTCOME_RECORDED,
    MEDICAL_TASK_CREATED,
    MEDICAL_TASK_STATUS_CHANGED,
    MEDICAL_TASK_COMPLETED,
    MEDICAL_RECORD_CREATED,
    APPLICATION_SUBMITTED,
    APPLICATION_STATUS_CHANGED,
    APPLICATION_FINALIZED,
    FOSTER_ASSIGNMENT_OPENED,
    FOSTER_ASSIGNMENT_CLOSED,
    ADOPTION_CREATED,
    PERSON_CREATED,
    PERSON_UPDATED,
    NOTE_ADDED,
    PHOTO_ADDED
}
