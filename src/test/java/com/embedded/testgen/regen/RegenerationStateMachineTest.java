package com.embedded.testgen.regen;

import com.embedded.testgen.validation.QualityTier;
import com.embedded.testgen.validation.ValidationReport;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;

class RegenerationStateMachineTest {

    private static final RegenerationSettings SETTINGS = RegenerationSettings.of(2, QualityTier.HIGH, true);

    private static final ValidationReport HIGH = ValidationReport.builder()
            .subjectFile("sensor.c").compiles(true).realistic(true).build();
    private static final ValidationReport LOW = ValidationReport.builder()
            .subjectFile("sensor.c").compiles(false).realistic(true).issue("Missing required Unity include").build();

    @Test
    void testForwardTransitions() {
        assertThat(RegenerationStateMachine.next(RegenerationState.INIT, null, 0, SETTINGS))
                .isEqualTo(RegenerationState.GENERATING);
        assertThat(RegenerationStateMachine.next(RegenerationState.GENERATING, null, 1, SETTINGS))
                .isEqualTo(RegenerationState.VALIDATING);
        assertThat(RegenerationStateMachine.next(RegenerationState.VALIDATING, LOW, 1, SETTINGS))
                .isEqualTo(RegenerationState.DECIDING);
        assertThat(RegenerationStateMachine.next(RegenerationState.REGENERATING, null, 1, SETTINGS))
                .isEqualTo(RegenerationState.GENERATING);
    }

    @Test
    void testDecidingAcceptsWhenThresholdMet() {
        assertThat(RegenerationStateMachine.next(RegenerationState.DECIDING, HIGH, 1, SETTINGS))
                .isEqualTo(RegenerationState.ACCEPTED);
    }

    @Test
    void testDecidingRegeneratesWhileBudgetRemains() {
        assertThat(RegenerationStateMachine.next(RegenerationState.DECIDING, LOW, 1, SETTINGS))
                .isEqualTo(RegenerationState.REGENERATING);
        assertThat(RegenerationStateMachine.next(RegenerationState.DECIDING, LOW, 2, SETTINGS))
                .isEqualTo(RegenerationState.REGENERATING);
        assertThat(RegenerationStateMachine.next(RegenerationState.DECIDING, LOW, 3, SETTINGS))
                .isEqualTo(RegenerationState.ACCEPTED);
    }

    @Test
    void testDecidingAcceptsWhenRegenerationDisabled() {
        RegenerationSettings disabled = RegenerationSettings.of(2, QualityTier.HIGH, false);

        assertThat(disabled.getMaxAttempts()).isEqualTo(1);
        assertThat(RegenerationStateMachine.next(RegenerationState.DECIDING, LOW, 1, disabled))
                .isEqualTo(RegenerationState.ACCEPTED);
    }

    @Test
    void testDecidingRequiresReport() {
        assertThatThrownBy(() -> RegenerationStateMachine.next(RegenerationState.DECIDING, null, 1, SETTINGS))
                .isInstanceOf(IllegalStateException.class);
    }

    @ParameterizedTest
    @EnumSource(value = RegenerationState.class, names = {"ACCEPTED", "EXHAUSTED"})
    void testTerminalStatesHaveNoTransitions(RegenerationState state) {
        assertThat(state.isTerminal()).isTrue();
        assertThatThrownBy(() -> RegenerationStateMachine.next(state, HIGH, 1, SETTINGS))
                .isInstanceOf(IllegalStateException.class);
    }

    @ParameterizedTest
    @EnumSource(value = RegenerationState.class, names = {"GENERATING"}, mode = EnumSource.Mode.EXCLUDE)
    void testGenerationFailsOnlyWhileGenerating(RegenerationState state) {
        assertThatThrownBy(() -> RegenerationStateMachine.onGenerationFailure(state))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testGenerationFailureExhausts() {
        assertThat(RegenerationStateMachine.onGenerationFailure(RegenerationState.GENERATING))
                .isEqualTo(RegenerationState.EXHAUSTED);
    }

    @Test
    void testSettings() {
        assertThat(RegenerationSettings.of(0, QualityTier.MEDIUM, true).getMaxAttempts()).isEqualTo(1);
        assertThat(SETTINGS.getMaxAttempts()).isEqualTo(3);
        assertThatThrownBy(() -> RegenerationSettings.of(-1, QualityTier.HIGH, true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
