package com.fourpaws.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes returned in {@code ProblemResponse.code}.
 * Every code is permanent for the given input except {@link #CONCURRENT_MODIFICATION}.
 */
public enum ErrorCode {
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    NOT_A_MEMBER(HttpStatus.FORBIDDEN),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN),
    UNKNOWN_ENTITY(HttpStatus.NOT_FOUND),
    INVALID_TRANSITION(HttpStatus.CONFLICT),
    ALREADY_TERMINAL(HttpStatus.CONFLICT),
    ANIMAL_ALREADY_FOSTERED(HttpStatus.CONFLICT),
    APPLICATION_NOT_APPROVED(HttpStatus.CONFLICT),
    CONCURRENT_MODIFICATION(HttpStatus.CONFLICT),
    LAST_ADMIN(HttpStatus.CONFLICT),
    DUPLICATE_MEMBERSHIP(HttpStatus.CONFLICT),
    DUPLICATE_SLUG(HttpStatus.CONFLICT),
    INVALID_AMOUNT(HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_ATTRIBUTES(HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_REQUEST(HttpStatus.UNPROCESSABLE_ENTITY);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
