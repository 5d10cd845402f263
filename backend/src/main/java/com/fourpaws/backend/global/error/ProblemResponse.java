package com.fourpaws.backend.global.error;

import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

/**
 * RFC 7807 style error body. {@code code} carries the stable {@link ErrorCode} name when the
 * failure came from the workflow; {@code requestId} echoes the id logged for the request.
 */
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        String requestId
) {

    static final String TYPE_PREFIX = "urn:problem:fourpaws:";

    public static ProblemResponse of(ProblemException ex, String instance) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return new ProblemResponse(ex.getProblemType(), status.getReasonPhrase(), status.value(),
                ex.getDetailMessage(), instance, ex.getCode(), MDC.get("requestId"));
    }

    public static ProblemResponse of(ErrorCode errorCode, String detail, String instance) {
        return of(new ProblemException(errorCode, detail), instance);
    }

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(TYPE_PREFIX + normalize(safeCode), httpStatus.getReasonPhrase(),
                httpStatus.value(), safeDetail, instance, safeCode, MDC.get("requestId"));
    }

    static String normalize(String code) {
        return code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
    }
}
