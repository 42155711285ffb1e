package com.demo.loadclient.tracer;

import com.demo.loadclient.metrics.BuiltinMetrics;
import com.demo.loadclient.metrics.Sample;
import com.demo.loadclient.metrics.SampleContainer;
import com.demo.loadclient.metrics.TagsAndMeta;
import org.springframework.lang.Nullable;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Timing and connection facts of one round trip, and the samples materialized from them.
 *
 * Timings may still be extended (body read finished) until the samples are materialized;
 * after that the trail is sealed.
 */
public class Trail implements SampleContainer {

    private Instant endTime;

    // connect + TLS handshake
    private final Duration connDuration;

    // excludes DNS lookup and connect time
    private Duration duration;

    @Nullable
    private final InetSocketAddress connRemoteAddr;

    @Nullable
    private Boolean failed;

    private Map<String, String> tags = Map.of();
    private Map<String, String> metadata = Map.of();
    private final List<Sample> samples = new ArrayList<>(3);
    private boolean sealed;

    public Trail(Instant endTime, Duration connDuration, Duration duration, @Nullable InetSocketAddress connRemoteAddr) {
        this.endTime = endTime;
        this.connDuration = connDuration;
        this.duration = duration;
        this.connRemoteAddr = connRemoteAddr;
    }

    /**
     * Move the end of the round trip, e.g. once the response body has been read.
     * @return false if the samples were already materialized and nothing changed
     */
    public synchronized boolean extend(Instant newEndTime, Duration newDuration) {
        if (sealed) {
            return false;
        }
        this.endTime = newEndTime;
        this.duration = newDuration;
        return true;
    }

    /**
     * Append the request count and request duration samples, stamped with the end time.
     * Only the first call has an effect.
     *
     * @return true if samples were added by this call
     */
    public synchronized boolean materializeSamples(BuiltinMetrics builtinMetrics, TagsAndMeta tagsAndMeta) {
        if (sealed) {
            return false;
        }
        sealed = true;
        this.tags = tagsAndMeta.tags();
        this.metadata = tagsAndMeta.metadata();
        samples.add(new Sample(builtinMetrics.httpReqs(), tags, metadata, endTime, 1));
        samples.add(new Sample(builtinMetrics.httpReqDuration(), tags, metadata, endTime, toMillis(duration)));
        return true;
    }

    public synchronized void appendSample(Sample sample) {
        samples.add(sample);
    }

    public synchronized boolean isSealed() {
        return sealed;
    }

    public synchronized void setFailed(boolean failed) {
        this.failed = failed;
    }

    /** Empty while no response expectation has been evaluated. */
    public synchronized Optional<Boolean> getFailed() {
        return Optional.ofNullable(failed);
    }

    public synchronized Instant getEndTime() {
        return endTime;
    }

    public Duration getConnDuration() {
        return connDuration;
    }

    public synchronized Duration getDuration() {
        return duration;
    }

    @Nullable
    public InetSocketAddress getConnRemoteAddr() {
        return connRemoteAddr;
    }

    @Override
    public synchronized List<Sample> getSamples() {
        return List.copyOf(samples);
    }

    @Override
    public synchronized Map<String, String> getTags() {
        return tags;
    }

    @Override
    public synchronized Instant getTime() {
        return endTime;
    }

    public synchronized Map<String, String> getMetadata() {
        return metadata;
    }

    static double toMillis(Duration d) {
        return d.toNanos() / 1_000_000.0;
    }
}
