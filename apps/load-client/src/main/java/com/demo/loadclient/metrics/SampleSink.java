package com.demo.loadclient.metrics;

/**
 * Destination of finished samples.
 */
public interface SampleSink {

    /**
     * Push one batch.
     * @return false when the sink is already finished and the batch was dropped
     */
    boolean push(SampleContainer container);
}
