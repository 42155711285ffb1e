package com.demo.loadclient.errors;

import org.springframework.lang.Nullable;

/**
 * An error that already knows its code and user-facing message.
 * The classifier returns both verbatim instead of inspecting the cause.
 */
public class ClassifiedException extends RuntimeException {

    private final ErrorCode code;

    public ClassifiedException(ErrorCode code, String message, @Nullable Throwable originalError) {
        super(message, originalError);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
