package com.demo.loadclient.metrics;

/**
 * Metric definitions every request and check sample refers to.
 */
public final class BuiltinMetrics {

    private final Metric httpReqs;
    private final Metric httpReqDuration;
    private final Metric httpReqFailed;
    private final Metric checks;

    public BuiltinMetrics() {
        this.httpReqs = new Metric("http_reqs", MetricType.COUNTER);
        this.httpReqDuration = new Metric("http_req_duration", MetricType.TREND);
        this.httpReqFailed = new Metric("http_req_failed", MetricType.RATE);
        this.checks = new Metric("checks", MetricType.RATE);
    }

    public Metric httpReqs() {
        return httpReqs;
    }

    /** Milliseconds. */
    public Metric httpReqDuration() {
        return httpReqDuration;
    }

    public Metric httpReqFailed() {
        return httpReqFailed;
    }

    public Metric checks() {
        return checks;
    }
}
