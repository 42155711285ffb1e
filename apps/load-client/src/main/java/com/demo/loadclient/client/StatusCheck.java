package com.demo.loadclient.client;

import com.demo.loadclient.metrics.Check;
import com.demo.loadclient.metrics.ExecutionState;
import com.demo.loadclient.metrics.Sample;
import com.demo.loadclient.metrics.SystemTag;
import com.demo.loadclient.metrics.TagsAndMeta;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * Asserts the status of a response and records the outcome as a {@code checks} sample.
 */
public class StatusCheck {
    private final ExecutionState state;

    public StatusCheck(ExecutionState state) {
        this.state = state;
    }

    public boolean check(int wantStatus, @Nullable ClientResponse response, Map<String, String> extraTags) {
        if (response == null) {
            throw new IllegalArgumentException("no response to check the status of");
        }

        String name = "check status is " + wantStatus;
        boolean pass = response.getStatus() == wantStatus;

        TagsAndMeta tags = state.currentTags();
        extraTags.forEach(tags::setTag);
        tags.setSystemTagIfEnabled(state.getSystemTags(), SystemTag.CHECK, name);

        Check check = state.getChecks().check(name);
        check.record(pass);
        state.getSink().push(new Sample(state.getBuiltinMetrics().checks(), tags.tags(), tags.metadata(),
            Instant.now(), pass ? 1 : 0));
        return pass;
    }
}
