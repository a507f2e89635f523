package com.memberguard.backend.lifecycle;

/**
 * Summary of one sweep. Failures are per candidate; a sweep itself never fails.
 */
public record JobReport(LifecycleJob job, int candidates, int succeeded, int skipped, int failed) {

    public static JobReport empty(LifecycleJob job) {
        return new JobReport(job, 0, 0, 0, 0);
    }
}
