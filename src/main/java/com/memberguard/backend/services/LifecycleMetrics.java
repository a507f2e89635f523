package com.memberguard.backend.services;

import com.memberguard.backend.lifecycle.JobReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Per-job run counters and timers under {@code lifecycle.*}
 */
@Component
@RequiredArgsConstructor
public class LifecycleMetrics {

    private final MeterRegistry meterRegistry;

    public Timer.Sample start() {
        return Timer.start(meterRegistry);
    }

    public void record(Timer.Sample sample, JobReport report) {
        String job = report.job().name().toLowerCase(Locale.ROOT);

        Counter.builder("lifecycle.job.runs")
                .description("Number of lifecycle job runs")
                .tag("job", job)
                .register(meterRegistry)
                .increment();

        Counter.builder("lifecycle.job.succeeded")
                .description("Candidates processed successfully")
                .tag("job", job)
                .register(meterRegistry)
                .increment(report.succeeded());

        Counter.builder("lifecycle.job.failed")
                .description("Candidates that failed and were left for the next run")
                .tag("job", job)
                .register(meterRegistry)
                .increment(report.failed());

        sample.stop(Timer.builder("lifecycle.job.duration")
                .description("Time taken by one lifecycle job run")
                .tag("job", job)
                .tag("status", report.failed() == 0 ? "success" : "partial")
                .register(meterRegistry));
    }
}
