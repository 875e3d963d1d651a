package com.embedded.testgen.regen;

import com.embedded.testgen.validation.ValidationReport;

import lombok.experimental.UtilityClass;

/**
 * Transition function of the per-file regeneration loop. Holds no state; the controller
 * feeds it the current state and the facts of the attempt in progress.
 */
@UtilityClass
public class RegenerationStateMachine {

    /**
     * @param report  the current attempt's report; required in {@link RegenerationState#DECIDING}
     * @param attempt 1-based number of the attempt in progress
     * @throws IllegalStateException when called from a terminal state
     */
    public static RegenerationState next(RegenerationState state, ValidationReport report, int attempt,
            RegenerationSettings settings) {
        return switch (state) {
            case INIT, REGENERATING -> RegenerationState.GENERATING;
            case GENERATING -> RegenerationState.VALIDATING;
            case VALIDATING -> RegenerationState.DECIDING;
            case DECIDING -> decide(report, attempt, settings);
            case ACCEPTED, EXHAUSTED -> throw new IllegalStateException("No transition out of terminal state " + state);
        };
    }

    /**
     * A generation failure ends the file without further attempts.
     */
    public static RegenerationState onGenerationFailure(RegenerationState state) {
        if (state != RegenerationState.GENERATING) {
            throw new IllegalStateException("Generation cannot fail in state " + state);
        }
        return RegenerationState.EXHAUSTED;
    }

    /**
     * Accepts when the report meets the threshold, when regeneration is off, or when the attempt
     * budget is spent. A report accepted for the last reason stays below threshold.
     */
    static RegenerationState decide(ValidationReport report, int attempt, RegenerationSettings settings) {
        if (report == null) {
            throw new IllegalStateException("A validation report is required to decide");
        }
        if (report.meets(settings.getThreshold())
                || !settings.isRegenerationEnabled()
                || attempt >= settings.getMaxAttempts()) {
            return RegenerationState.ACCEPTED;
        }
        return RegenerationState.REGENERATING;
    }
}
