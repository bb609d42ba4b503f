package com.todolist.api;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Request counters, latency histograms and the todo row-count gauge.
 *
 * Exposed by Prometheus as {@code http_requests_total}, {@code http_request_duration_seconds} and {@code todo_items}.
 */
@Component
public class TodoMetrics {
    static final String REQUESTS = "http.requests";
    static final String REQUEST_DURATION = "http.request.duration";
    static final String ITEMS = "todo.items";

    private final MeterRegistry registry;
    private final AtomicLong itemCount = new AtomicLong();

    public TodoMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(ITEMS, itemCount, AtomicLong::get)
            .description("Number of todo items currently stored")
            .register(registry);
    }

    public void recordRequest(String method, String endpoint, int status, long durationNanos) {
        Counter.builder(REQUESTS)
            .description("Total HTTP requests")
            .tag("method", method)
            .tag("endpoint", endpoint)
            .tag("status", Integer.toString(status))
            .register(registry)
            .increment();

        Timer.builder(REQUEST_DURATION)
            .description("HTTP request latency")
            .tag("method", method)
            .tag("endpoint", endpoint)
            .publishPercentileHistogram()
            .register(registry)
            .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void updateItemCount(long count) {
        itemCount.set(count);
    }

    public long itemCount() {
        return itemCount.get();
    }
}
