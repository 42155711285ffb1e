package com.demo.loadclient.metrics;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checks of one run, created on first use and shared by every caller.
 */
public class CheckRegistry {

    static final String NAME_SEPARATOR = "::";

    private final Map<String, Check> checks = new ConcurrentHashMap<>();

    public Check check(String name) {
        if (name.isEmpty() || name.contains(NAME_SEPARATOR)) {
            throw new IllegalArgumentException("invalid check name: '" + name + "'");
        }
        return checks.computeIfAbsent(name, Check::new);
    }

    public Collection<Check> all() {
        return List.copyOf(checks.values());
    }
}
