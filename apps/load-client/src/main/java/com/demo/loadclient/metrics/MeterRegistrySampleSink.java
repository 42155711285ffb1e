package com.demo.loadclient.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sample sink backed by a Micrometer registry.
 * Exposes request and check metrics via the /actuator/prometheus endpoint.
 *
 * Every meter carries the same fixed set of tag keys (empty when a sample lacks one),
 * since Prometheus rejects meters of one name with differing keys.
 */
@Service
public class MeterRegistrySampleSink implements SampleSink {
    private static final Logger logger = LoggerFactory.getLogger(MeterRegistrySampleSink.class);

    public static final List<String> DEFAULT_DIMENSIONS = List.of(
        SystemTag.NAME.tagName(),
        SystemTag.METHOD.tagName(),
        SystemTag.STATUS.tagName(),
        SystemTag.ERROR_CODE.tagName(),
        SystemTag.EXPECTED_RESPONSE.tagName(),
        SystemTag.CHECK.tagName()
    );

    private final MeterRegistry registry;
    private final List<String> dimensions;
    private final AtomicBoolean finished = new AtomicBoolean(false);

    @Autowired
    public MeterRegistrySampleSink(MeterRegistry registry,
                                   @Value("${metrics.dimensions:}") List<String> dimensions) {
        this.registry = registry;
        this.dimensions = dimensions == null || dimensions.isEmpty() ? DEFAULT_DIMENSIONS : List.copyOf(dimensions);
    }

    @Override
    public boolean push(SampleContainer container) {
        if (finished.get()) {
            logger.debug("Sink finished, dropping {} samples", container.getSamples().size());
            return false;
        }
        for (Sample sample : container.getSamples()) {
            try {
                record(sample);
            } catch (RuntimeException e) {
                logger.warn("Failed to record sample {}", sample.metric().name(), e);
            }
        }
        return true;
    }

    /**
     * Stop accepting samples; later pushes are dropped.
     */
    @PreDestroy
    public void finish() {
        if (finished.compareAndSet(false, true)) {
            logger.info("Sample sink finished");
        }
    }

    public boolean isFinished() {
        return finished.get();
    }

    private void record(Sample sample) {
        List<Tag> tags = toTags(sample);
        Metric metric = sample.metric();
        switch (metric.type()) {
            case COUNTER -> Counter.builder(metric.name())
                .tags(tags)
                .register(registry)
                .increment(sample.value());
            // trends are durations in milliseconds
            case TREND -> Timer.builder(metric.name())
                .tags(tags)
                .register(registry)
                .record((long) (sample.value() * 1_000_000), TimeUnit.NANOSECONDS);
            // mean of a 0/1 summary is the rate
            case RATE -> DistributionSummary.builder(metric.name())
                .tags(tags)
                .register(registry)
                .record(sample.value());
        }
    }

    private List<Tag> toTags(Sample sample) {
        List<Tag> tags = new ArrayList<>(dimensions.size());
        for (String key : dimensions) {
            tags.add(Tag.of(key, sample.tags().getOrDefault(key, "")));
        }
        return tags;
    }
}
