package com.fourpaws.backend.modules.placement.domain;

public enum FosterAssignmentStatus {
    ACTIVE,
    COMPLETED,
    FAILED
}
