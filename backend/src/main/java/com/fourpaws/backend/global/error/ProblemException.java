package com.fourpaws.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(ErrorCode errorCode) {
        this(errorCode.getStatus(), errorCode.name(), null);
    }

    public ProblemException(ErrorCode errorCode, String detail) {
        this(errorCode.getStatus(), errorCode.name(), detail);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        this.type = ProblemResponse.TYPE_PREFIX + ProblemResponse.normalize(code);
    }

    public static ProblemException unknownEntity(String entityType) {
        return new ProblemException(ErrorCode.UNKNOWN_ENTITY, entityType + " not found");
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }

    public boolean hasCode(ErrorCode errorCode) {
        return errorCode.name().equals(code);
    }
}
