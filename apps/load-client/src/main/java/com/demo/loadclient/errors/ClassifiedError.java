package com.demo.loadclient.errors;

import org.springframework.lang.Nullable;

/**
 * Classification result for a failed request.
 */
public record ClassifiedError(
    ErrorCode code,
    String message,
    @Nullable Throwable cause
) {
    public boolean isDefault() {
        return ErrorCode.DEFAULT.equals(code);
    }
}
