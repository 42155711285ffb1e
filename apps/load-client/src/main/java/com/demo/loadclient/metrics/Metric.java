package com.demo.loadclient.metrics;

public record Metric(String name, MetricType type) {
}
