package com.example.courier.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the real-time channel: connection lifecycle, frame delivery and
 * routing latency.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    @Bean
    public MeterBinder realtimeMetrics() {
        return registry -> {
            registry.counter("courier.realtime.frames.delivered");
            registry.counter("courier.realtime.frames.dropped", "reason", "overflow");
            registry.counter("courier.realtime.frames.dropped", "reason", "closed");
            registry.counter("courier.realtime.connections.closed", "reason", "protocol_error");
            registry.counter("courier.realtime.connections.closed", "reason", "buffer_overflow");
            registry.counter("courier.realtime.auth.rejected");

            Timer.builder("courier.realtime.route.latency")
                  .description("Time taken to fan one domain event out to its connections")
                  .register(registry);
        };
    }

    @Bean
    public RealtimeMetricsCollector realtimeMetricsCollector(MeterRegistry registry) {
        return new RealtimeMetricsCollector(registry);
    }

    /**
     * Caches meters by name and tags so hot paths do not hit the registry lookup.
     */
    public static class RealtimeMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

        public RealtimeMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            incrementCounter(name, 1, tags);
        }

        public void incrementCounter(String name, double amount, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment(amount);
        }

        public void recordTimer(String name, long durationMillis, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k ->
                Timer.builder(name).tags(tags).register(registry))
                  .record(durationMillis, TimeUnit.MILLISECONDS);
        }

        public void setGauge(String name, long value, String... tags) {
            String key = name + "_" + String.join("_", tags);
            AtomicLong gauge = gauges.computeIfAbsent(key, k -> {
                AtomicLong newGauge = new AtomicLong();
                registry.gauge(name, Tags.of(tags), newGauge);
                return newGauge;
            });
            gauge.set(value);
        }

        public long getCounterValue(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            Counter counter = counters.get(key);
            return counter != null ? (long) counter.count() : 0;
        }
    }
}
