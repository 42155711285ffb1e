package com.demo.loadclient.metrics;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One timestamped, tagged data point.
 */
public record Sample(
    Metric metric,
    Map<String, String> tags,
    Map<String, String> metadata,
    Instant time,
    double value
) implements SampleContainer {

    public Sample {
        tags = Map.copyOf(tags);
        metadata = Map.copyOf(metadata);
    }

    @Override
    public List<Sample> getSamples() {
        return List.of(this);
    }

    @Override
    public Map<String, String> getTags() {
        return tags;
    }

    @Override
    public Instant getTime() {
        return time;
    }
}
