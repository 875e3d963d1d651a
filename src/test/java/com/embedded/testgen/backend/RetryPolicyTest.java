package com.embedded.testgen.backend;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RetryPolicyTest {

    private static final CallResult THROTTLED =
            CallResult.failure(FailureKind.THROTTLING, new BackendCallException("429", 429, null));

    private final RetryPolicy policy = RetryPolicy.defaults();

    @Test
    void testSuccessIsReturned() {
        RetryDecision decision = policy.decide(0, CallResult.success("code"));

        assertThat(decision.getAction()).isEqualTo(RetryDecision.Action.SUCCEED);
        assertThat(decision.getText()).isEqualTo("code");
    }

    @Test
    void testThrottlingBacksOffExponentially() {
        assertThat(policy.decide(0, THROTTLED).getAction()).isEqualTo(RetryDecision.Action.RETRY_SAME_BACKEND);
        assertThat(policy.decide(0, THROTTLED).getDelayMillis()).isEqualTo(1000);
        assertThat(policy.decide(1, THROTTLED).getDelayMillis()).isEqualTo(2000);
    }

    @Test
    void testThrottlingOnLastTrySwitchesBackend() {
        assertThat(policy.decide(2, THROTTLED).getAction()).isEqualTo(RetryDecision.Action.SWITCH_BACKEND);
    }

    @Test
    void testSingleTryPolicySwitchesImmediately() {
        RetryPolicy once = RetryPolicy.builder().maxTries(1).build();

        assertThat(once.decide(0, THROTTLED).getAction()).isEqualTo(RetryDecision.Action.SWITCH_BACKEND);
    }

    @Test
    void testOtherFailuresAreTerminal() {
        CallResult failed = CallResult.failure(FailureKind.OTHER, new BackendCallException("HTTP 400: bad request"));

        RetryDecision decision = policy.decide(0, failed);

        assertThat(decision.getAction()).isEqualTo(RetryDecision.Action.TERMINAL);
        assertThat(decision.getReason()).isEqualTo("Non-retryable backend failure: HTTP 400: bad request");
    }

    @Test
    void testDelayIsCapped() {
        RetryPolicy steep = RetryPolicy.builder().baseDelayMillis(10_000).multiplier(10).maxDelayMillis(30_000).build();

        assertThat(steep.delayFor(0)).isEqualTo(10_000);
        assertThat(steep.delayFor(1)).isEqualTo(30_000);
        assertThat(steep.delayFor(5)).isEqualTo(30_000);
    }
}
