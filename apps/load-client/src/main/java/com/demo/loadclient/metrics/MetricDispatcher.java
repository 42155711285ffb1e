package com.demo.loadclient.metrics;

import com.demo.loadclient.errors.ClassifiedError;
import com.demo.loadclient.errors.ErrorClassifier;
import com.demo.loadclient.errors.ErrorCode;
import com.demo.loadclient.tracer.Trail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.function.IntPredicate;

/**
 * Holds at most one staged request per client and emits its samples later.
 *
 * A request is staged right after its round trip and emitted when the next request is
 * staged or drained, so the body read that happens in between is part of the measured
 * duration. Swapping the slot and emitting the previous request happen under one
 * acquisition of a non-reentrant lock: every request is emitted exactly once, and always
 * before the one after it.
 */
public class MetricDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(MetricDispatcher.class);

    private final ExecutionState state;
    private final ErrorClassifier classifier;
    private final TagsAndMeta tagsAndMeta;
    private final Semaphore lock = new Semaphore(1);

    @Nullable
    private UnfinishedRequest staged;

    public MetricDispatcher(ExecutionState state, ErrorClassifier classifier) {
        this.state = state;
        this.classifier = classifier;
        this.tagsAndMeta = state.currentTags();
    }

    /**
     * Stage the request that just completed its round trip. A request still sitting in the
     * slot is emitted first.
     */
    public void stage(UnfinishedRequest current) {
        lock.acquireUninterruptibly();
        try {
            UnfinishedRequest previous = staged;
            staged = current;
            if (previous != null) {
                // one request in flight per client, so the slot should have been drained
                logger.warn("Unexpected unprocessed request for {}", previous.getUrl());
                measureAndEmit(previous);
            }
        } finally {
            lock.release();
        }
    }

    /**
     * Take the staged request, if any, and emit it.
     *
     * @param lastError failure discovered after the round trip; attached only when the
     *                  staged request has no error of its own
     * @return the emitted request, or empty if nothing was staged
     */
    public Optional<FinishedRequest> drainAndEmit(@Nullable Throwable lastError) {
        lock.acquireUninterruptibly();
        try {
            UnfinishedRequest unprocessed = staged;
            staged = null;
            if (unprocessed == null) {
                return Optional.empty();
            }
            unprocessed.attachErrorIfUnset(lastError);
            return Optional.of(measureAndEmit(unprocessed));
        } finally {
            lock.release();
        }
    }

    public boolean hasStaged() {
        lock.acquireUninterruptibly();
        try {
            return staged != null;
        } finally {
            lock.release();
        }
    }

    private FinishedRequest measureAndEmit(UnfinishedRequest request) {
        Trail trail = request.getTrail();
        TagsAndMeta tags = tagsAndMeta.copy();
        Set<SystemTag> enabled = state.getSystemTags();
        IntPredicate responseCallback = state.getResponseCallback();

        ErrorCode errorCode = null;
        String errorMessage = null;
        Boolean expected = null;
        try {
            request.getRequestTags().forEach(tags::setTag);

            String name = tags.getTag(SystemTag.NAME.tagName());
            if (name == null) {
                tags.setSystemTagIfEnabled(enabled, SystemTag.NAME, request.getUrl());
                tags.setSystemTagIfEnabled(enabled, SystemTag.URL, request.getUrl());
            } else {
                // a user supplied name replaces the raw URL, keeping the url tag low-cardinality
                tags.setSystemTagIfEnabled(enabled, SystemTag.URL, name);
            }

            tags.setSystemTagIfEnabled(enabled, SystemTag.METHOD, request.getMethod());
            if (request.getProto() != null) {
                tags.setSystemTagIfEnabled(enabled, SystemTag.PROTO, request.getProto());
            }

            Throwable error = request.getError();
            int status = request.getStatus() != null ? request.getStatus() : 0;
            if (error != null) {
                ClassifiedError classified = classifier.classify(error);
                errorCode = classified.code();
                errorMessage = classified.message();
                tags.setSystemTagIfEnabled(enabled, SystemTag.ERROR, String.valueOf(errorMessage));
                tags.setSystemTagIfEnabled(enabled, SystemTag.ERROR_CODE, errorCode.toString());
                tags.setSystemTagIfEnabled(enabled, SystemTag.STATUS, "0");
                status = 0;
            } else {
                tags.setSystemTagIfEnabled(enabled, SystemTag.STATUS, Integer.toString(status));
                if (status >= 400) {
                    errorCode = ErrorCode.fromHttpStatus(status);
                    tags.setSystemTagIfEnabled(enabled, SystemTag.ERROR_CODE, errorCode.toString());
                }
            }

            InetSocketAddress remote = trail.getConnRemoteAddr();
            if (enabled.contains(SystemTag.IP) && remote != null) {
                InetAddress address = remote.getAddress();
                if (address != null) {
                    tags.setSystemTag(SystemTag.IP, address.getHostAddress());
                }
            }

            if (responseCallback != null) {
                expected = responseCallback.test(status);
                tags.setSystemTagIfEnabled(enabled, SystemTag.EXPECTED_RESPONSE, Boolean.toString(expected));
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to resolve tags for {} {}, emitting what was resolved", request.getMethod(),
                request.getUrl(), e);
        }

        BuiltinMetrics builtinMetrics = state.getBuiltinMetrics();
        if (!trail.materializeSamples(builtinMetrics, tags)) {
            logger.warn("Samples for {} were already emitted, skipping", request.getUrl());
            return new FinishedRequest(request, trail, errorCode, errorMessage);
        }
        if (responseCallback != null) {
            boolean failed = expected == null || !expected;
            trail.setFailed(failed);
            trail.appendSample(new Sample(builtinMetrics.httpReqFailed(), trail.getTags(), trail.getMetadata(),
                trail.getEndTime(), failed ? 1 : 0));
        }

        state.getSink().push(trail);
        return new FinishedRequest(request, trail, errorCode, errorMessage);
    }
}
