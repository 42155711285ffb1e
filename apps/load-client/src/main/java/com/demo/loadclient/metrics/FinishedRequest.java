package com.demo.loadclient.metrics;

import com.demo.loadclient.errors.ErrorCode;
import com.demo.loadclient.tracer.Trail;
import org.springframework.lang.Nullable;

/**
 * A request whose samples have been materialized and pushed. Error code is null on a
 * successful response below 400; the message is null unless a transport error occurred.
 */
public record FinishedRequest(
    UnfinishedRequest request,
    Trail trail,
    @Nullable ErrorCode errorCode,
    @Nullable String errorMessage
) {
}
