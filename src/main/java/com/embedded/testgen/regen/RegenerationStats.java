package com.embedded.testgen.regen;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run-wide counters. Written by the controller only, read for the end-of-run summary.
 */
public class RegenerationStats {

    private final AtomicInteger attemptsIssued = new AtomicInteger();
    private final AtomicInteger regenerations = new AtomicInteger();
    private final AtomicInteger successfulRegenerations = new AtomicInteger();

    void recordAttempt() {
        attemptsIssued.incrementAndGet();
    }

    void recordRegeneration() {
        regenerations.incrementAndGet();
    }

    void recordSuccessfulRegeneration() {
        successfulRegenerations.incrementAndGet();
    }

    public int getAttemptsIssued() {
        return attemptsIssued.get();
    }

    /** Attempts started because a previous attempt scored below threshold. */
    public int getRegenerations() {
        return regenerations.get();
    }

    /** Files that reached the threshold on an attempt after the first. */
    public int getSuccessfulRegenerations() {
        return successfulRegenerations.get();
    }

    /**
     * Successful regenerations as a percentage of regenerations issued, 0 when none were issued.
     */
    public double getSuccessRate() {
        int issued = regenerations.get();
        return issued == 0 ? 0.0 : successfulRegenerations.get() * 100.0 / issued;
    }
}
