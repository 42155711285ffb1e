package com.demo.loadclient.tracer;

import com.demo.loadclient.metrics.BuiltinMetrics;
import com.demo.loadclient.metrics.Sample;
import com.demo.loadclient.metrics.TagsAndMeta;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrailTest {

    private final BuiltinMetrics metrics = new BuiltinMetrics();

    private Trail newTrail(Instant end, Duration duration) {
        return new Trail(end, Duration.ofMillis(3), duration, null);
    }

    @Test
    void testMaterializeAddsCountAndDuration() {
        Instant end = Instant.parse("2024-01-01T00:00:00Z");
        Trail trail = newTrail(end, Duration.ofMillis(250));
        TagsAndMeta tags = new TagsAndMeta();
        tags.setTag("name", "home");

        assertTrue(trail.materializeSamples(metrics, tags));

        List<Sample> samples = trail.getSamples();
        assertEquals(2, samples.size());
        assertEquals("http_reqs", samples.get(0).metric().name());
        assertEquals(1.0, samples.get(0).value());
        assertEquals("http_req_duration", samples.get(1).metric().name());
        assertEquals(250.0, samples.get(1).value(), 0.0001);
        assertEquals(end, samples.get(1).time());
        assertEquals("home", trail.getTags().get("name"));
    }

    @Test
    void testMaterializationIsOneShot() {
        Trail trail = newTrail(Instant.now(), Duration.ofMillis(10));
        assertTrue(trail.materializeSamples(metrics, new TagsAndMeta()));
        assertFalse(trail.materializeSamples(metrics, new TagsAndMeta()));
        assertEquals(2, trail.getSamples().size());
        assertTrue(trail.isSealed());
    }

    @Test
    void testExtendBeforeMaterializeMovesEndTime() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Trail trail = newTrail(start, Duration.ofMillis(10));
        Instant later = start.plusMillis(40);

        assertTrue(trail.extend(later, Duration.ofMillis(50)));
        trail.materializeSamples(metrics, new TagsAndMeta());

        assertEquals(later, trail.getTime());
        assertEquals(50.0, trail.getSamples().get(1).value(), 0.0001);
    }

    @Test
    void testExtendAfterMaterializeIsIgnored() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Trail trail = newTrail(start, Duration.ofMillis(10));
        trail.materializeSamples(metrics, new TagsAndMeta());

        assertFalse(trail.extend(start.plusSeconds(1), Duration.ofSeconds(1)));
        assertEquals(start, trail.getEndTime());
        assertEquals(Duration.ofMillis(10), trail.getDuration());
    }

    @Test
    void testFailedFlagIsUnsetUntilEvaluated() {
        Trail trail = newTrail(Instant.now(), Duration.ZERO);
        assertTrue(trail.getFailed().isEmpty());
        trail.setFailed(true);
        assertEquals(Boolean.TRUE, trail.getFailed().orElseThrow());
    }

    @Test
    void testToMillisKeepsFraction() {
        assertEquals(1.5, Trail.toMillis(Duration.ofNanos(1_500_000)), 0.0001);
    }
}
