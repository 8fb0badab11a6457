package com.syncnest.accountservice.exception;

import com.syncnest.accountservice.model.FailureKind;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception carrying HTTP semantics for RFC 7807 responses.
 * Orchestration code converts these into {@code ServiceResult.Failure}; anything that
 * escapes is rendered by {@link GlobalExceptionHandler}.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final FailureKind kind;

    protected ApiException(FailureKind kind, String detail) {
        super(detail);
        this.kind = kind;
    }

    protected ApiException(FailureKind kind, String detail, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
    }

    public HttpStatus getStatus() {
        return kind.getStatus();
    }

    public String getType() {
        return kind.type();
    }

    public String getTitle() {
        return kind.getTitle();
    }

    /** Machine-readable error code. */
    public String code() {
        return kind.name();
    }

    /** Operational failures are opaque to clients and logged at ERROR. */
    public boolean isOperational() {
        return kind == FailureKind.INTERNAL_ERROR;
    }
}
