package com.fourpaws.backend.modules.pipeline.domain;

public enum ApplicationKind {
    ADOPTION,
    FOSTER
}
