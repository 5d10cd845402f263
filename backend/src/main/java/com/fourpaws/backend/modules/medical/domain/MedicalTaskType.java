package com.fourpaws.backend.modules.medical.domain;

public enum MedicalTaskType {
    VACCINE,
    TREATMENT,
    EXAM,
    SURGERY,
    CHECKUP,
    OTHER
}
