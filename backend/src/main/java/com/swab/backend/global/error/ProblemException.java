package com.swab.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * A {@link ResponseStatusException} carrying a stable machine-readable code and a human-readable detail.
 */
public class ProblemException extends ResponseStatusException {

    private static final String TYPE_PREFIX = "urn:problem:swab:";

    private final String code;
    private final String detail;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, Throwable cause) {
        super(status, code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public static ProblemException notFound(String code) {
        return new ProblemException(HttpStatus.NOT_FOUND, code);
    }

    public static ProblemException badRequest(String code, String detail) {
        return new ProblemException(HttpStatus.BAD_REQUEST, code, detail);
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return TYPE_PREFIX + code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
    }
}
