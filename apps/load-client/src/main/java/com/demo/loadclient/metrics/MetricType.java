package com.demo.loadclient.metrics;

public enum MetricType {
    COUNTER,
    TREND,
    RATE
}
