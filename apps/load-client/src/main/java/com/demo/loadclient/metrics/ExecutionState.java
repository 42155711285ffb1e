package com.demo.loadclient.metrics;

import org.springframework.lang.Nullable;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * What a client needs from the surrounding run: base tags, the enabled system tags,
 * where samples go, and the optional response expectation.
 */
public class ExecutionState {

    private final TagsAndMeta tags;
    private final Set<SystemTag> systemTags;
    private final SampleSink sink;
    private final BuiltinMetrics builtinMetrics;
    private final CheckRegistry checks;
    @Nullable
    private final IntPredicate responseCallback;

    public ExecutionState(TagsAndMeta tags, Set<SystemTag> systemTags, SampleSink sink,
                          @Nullable IntPredicate responseCallback) {
        this(tags, systemTags, sink, new BuiltinMetrics(), new CheckRegistry(), responseCallback);
    }

    public ExecutionState(TagsAndMeta tags, Set<SystemTag> systemTags, SampleSink sink,
                          BuiltinMetrics builtinMetrics, CheckRegistry checks,
                          @Nullable IntPredicate responseCallback) {
        this.tags = tags.copy();
        this.systemTags = systemTags.isEmpty() ? EnumSet.noneOf(SystemTag.class) : EnumSet.copyOf(systemTags);
        this.sink = sink;
        this.builtinMetrics = builtinMetrics;
        this.checks = checks;
        this.responseCallback = responseCallback;
    }

    /** A copy of the current run tags. */
    public TagsAndMeta currentTags() {
        return tags.copy();
    }

    public Set<SystemTag> getSystemTags() {
        return systemTags;
    }

    public SampleSink getSink() {
        return sink;
    }

    public BuiltinMetrics getBuiltinMetrics() {
        return builtinMetrics;
    }

    public CheckRegistry getChecks() {
        return checks;
    }

    @Nullable
    public IntPredicate getResponseCallback() {
        return responseCallback;
    }
}
