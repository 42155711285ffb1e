package com.demo.loadclient.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Named pass/fail counter.
 */
public class Check {

    private final String name;
    private final AtomicLong passes = new AtomicLong();
    private final AtomicLong fails = new AtomicLong();

    Check(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void record(boolean pass) {
        if (pass) {
            passes.incrementAndGet();
        } else {
            fails.incrementAndGet();
        }
    }

    public long getPasses() {
        return passes.get();
    }

    public long getFails() {
        return fails.get();
    }
}
