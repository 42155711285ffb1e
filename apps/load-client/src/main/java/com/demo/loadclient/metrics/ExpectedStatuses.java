package com.demo.loadclient.metrics;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Response callback accepting a set of statuses and status ranges, e.g. {@code "200-399,418"}.
 */
public final class ExpectedStatuses implements IntPredicate {

    private final List<int[]> ranges;

    private ExpectedStatuses(List<int[]> ranges) {
        this.ranges = ranges;
    }

    public static ExpectedStatuses range(int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException("min status " + min + " is above max status " + max);
        }
        return new ExpectedStatuses(List.of(new int[]{min, max}));
    }

    public static ExpectedStatuses parse(String statuses) {
        List<int[]> ranges = new ArrayList<>();
        for (String raw : statuses.split(",")) {
            String part = raw.trim();
            if (part.isEmpty()) {
                continue;
            }
            try {
                int dash = part.indexOf('-');
                if (dash > 0) {
                    int min = Integer.parseInt(part.substring(0, dash).trim());
                    int max = Integer.parseInt(part.substring(dash + 1).trim());
                    if (min > max) {
                        throw new IllegalArgumentException("invalid status range: " + part);
                    }
                    ranges.add(new int[]{min, max});
                } else {
                    int status = Integer.parseInt(part);
                    ranges.add(new int[]{status, status});
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid expected status: " + part, e);
            }
        }
        if (ranges.isEmpty()) {
            throw new IllegalArgumentException("no expected statuses in '" + statuses + "'");
        }
        return new ExpectedStatuses(List.copyOf(ranges));
    }

    @Override
    public boolean test(int status) {
        for (int[] range : ranges) {
            if (status >= range[0] && status <= range[1]) {
                return true;
            }
        }
        return false;
    }
}
