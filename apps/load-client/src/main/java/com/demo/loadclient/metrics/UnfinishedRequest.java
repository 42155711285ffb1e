package com.demo.loadclient.metrics;

import com.demo.loadclient.tracer.Trail;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * A completed round trip whose metrics have not been emitted yet.
 * Holds the response status (not the body), the trail, and the transport error if any.
 */
public class UnfinishedRequest {

    private final String method;
    private final String url;
    private final Map<String, String> requestTags;
    @Nullable
    private final Integer status;
    @Nullable
    private final String proto;
    private final Trail trail;
    @Nullable
    private Throwable error;

    public UnfinishedRequest(String method, String url, Map<String, String> requestTags,
                             @Nullable Integer status, @Nullable String proto,
                             Trail trail, @Nullable Throwable error) {
        this.method = method;
        this.url = url;
        this.requestTags = Map.copyOf(requestTags);
        this.status = status;
        this.proto = proto;
        this.trail = trail;
        this.error = error;
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getRequestTags() {
        return requestTags;
    }

    /** Null when no response was received. */
    @Nullable
    public Integer getStatus() {
        return status;
    }

    @Nullable
    public String getProto() {
        return proto;
    }

    public Trail getTrail() {
        return trail;
    }

    @Nullable
    public synchronized Throwable getError() {
        return error;
    }

    /**
     * Record a failure discovered after the round trip. An earlier error always wins.
     * @return true if the error was attached
     */
    public synchronized boolean attachErrorIfUnset(@Nullable Throwable lateError) {
        if (error != null || lateError == null) {
            return false;
        }
        error = lateError;
        return true;
    }
}
