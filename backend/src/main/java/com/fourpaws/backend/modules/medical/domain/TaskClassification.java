package com.fourpaws.backend.modules.medical.domain;

public enum TaskClassification {
    OVERDUE,
    DUE_TODAY,
    UPCOMING,
    COMPLETED,
    CANCELLED
}
