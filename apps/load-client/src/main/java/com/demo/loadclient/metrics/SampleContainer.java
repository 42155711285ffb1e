package com.demo.loadclient.metrics;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A batch of samples pushed to a {@link SampleSink} together.
 */
public interface SampleContainer {
    List<Sample> getSamples();

    Map<String, String> getTags();

    Instant getTime();
}
