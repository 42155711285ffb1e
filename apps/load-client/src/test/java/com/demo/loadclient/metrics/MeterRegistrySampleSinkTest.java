package com.demo.loadclient.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MeterRegistrySampleSinkTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MeterRegistrySampleSink sink = new MeterRegistrySampleSink(registry, List.of());
    private final BuiltinMetrics metrics = new BuiltinMetrics();

    private Sample sample(Metric metric, Map<String, String> tags, double value) {
        return new Sample(metric, tags, Map.of(), Instant.now(), value);
    }

    @Test
    void testRecordsEachMetricType() {
        Map<String, String> tags = Map.of("name", "home", "method", "GET", "status", "200");
        assertTrue(sink.push(sample(metrics.httpReqs(), tags, 1)));
        sink.push(sample(metrics.httpReqDuration(), tags, 125));
        sink.push(sample(metrics.httpReqFailed(), tags, 0));
        sink.push(sample(metrics.httpReqFailed(), tags, 1));

        Counter counter = registry.get("http_reqs").tag("name", "home").counter();
        assertEquals(1.0, counter.count());

        Timer timer = registry.get("http_req_duration").tag("status", "200").timer();
        assertEquals(1, timer.count());
        assertEquals(125.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);

        DistributionSummary failed = registry.get("http_req_failed").summary();
        assertEquals(0.5, failed.mean(), 0.0001);
    }

    @Test
    void testMissingDimensionsAreEmpty() {
        sink.push(sample(metrics.httpReqs(), Map.of("name", "x", "unrelated", "y"), 1));

        Counter counter = registry.get("http_reqs").counter();
        assertEquals("", counter.getId().getTag("error_code"));
        assertNull(counter.getId().getTag("unrelated"));
    }

    @Test
    void testCustomDimensions() {
        MeterRegistrySampleSink custom = new MeterRegistrySampleSink(registry, List.of("scenario"));
        custom.push(sample(metrics.checks(), Map.of("scenario", "login", "check", "c"), 1));

        DistributionSummary checks = registry.get("checks").tag("scenario", "login").summary();
        assertEquals(1, checks.count());
        assertNull(checks.getId().getTag("check"));
    }

    @Test
    void testDropsAfterFinish() {
        sink.finish();
        assertTrue(sink.isFinished());
        assertFalse(sink.push(sample(metrics.httpReqs(), Map.of(), 1)));
        assertNull(registry.find("http_reqs").counter());
    }
}
