package com.embedded.testgen.backend;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.embedded.testgen.exception.GenerationException;
import com.embedded.testgen.exception.GenerationInterruptedException;

/**
 * Calls an ordered list of backends with retry, backoff and sticky fallback.
 * <p>
 * The current backend is tried up to {@link RetryPolicy#getMaxTries()} times. When it keeps
 * throttling, every other backend is tried once in list order and the first one that answers
 * becomes current for all later calls. Not thread-safe; one instance serves one run.
 */
public class GenerationService {

    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);

    private final List<GenerationBackend> backends;
    private final RetryPolicy retryPolicy;
    private final FailureClassifier classifier;
    private final Sleeper sleeper;

    private int currentIndex;

    public GenerationService(List<GenerationBackend> backends, RetryPolicy retryPolicy,
            FailureClassifier classifier, Sleeper sleeper) {
        if (backends.isEmpty()) {
            throw new IllegalArgumentException("At least one generation backend is required");
        }
        this.backends = List.copyOf(backends);
        this.retryPolicy = retryPolicy;
        this.classifier = classifier;
        this.sleeper = sleeper;
    }

    public GenerationService(List<GenerationBackend> backends, RetryPolicy retryPolicy) {
        this(backends, retryPolicy, new FailureClassifier(), Sleeper.THREAD);
    }

    /**
     * @throws GenerationException when the current backend fails with a non-throttling error or
     *                             every backend has failed
     */
    public String generate(String prompt) {
        GenerationBackend current = backends.get(currentIndex);
        for (int tryIndex = 0; ; tryIndex++) {
            CallResult result = call(current, prompt);
            RetryDecision decision = retryPolicy.decide(tryIndex, result);
            switch (decision.getAction()) {
                case SUCCEED -> {
                    return decision.getText();
                }
                case RETRY_SAME_BACKEND -> {
                    log.warn("Backend {} throttled (try {}/{}), retrying in {} ms",
                            current.getName(), tryIndex + 1, retryPolicy.getMaxTries(), decision.getDelayMillis());
                    pause(decision.getDelayMillis());
                }
                case SWITCH_BACKEND -> {
                    log.warn("Backend {} still throttled after {} tries, trying fallbacks",
                            current.getName(), retryPolicy.getMaxTries());
                    return fallback(prompt, result.getError());
                }
                case TERMINAL -> throw new GenerationException(
                        current.getName() + ": " + decision.getReason(), result.getError());
            }
        }
    }

    public String getCurrentBackendName() {
        return backends.get(currentIndex).getName();
    }

    public List<GenerationBackend> getBackends() {
        return backends;
    }

    private String fallback(String prompt, BackendCallException firstFailure) {
        BackendCallException lastFailure = firstFailure;
        for (int i = 0; i < backends.size(); i++) {
            if (i == currentIndex) {
                continue;
            }
            GenerationBackend candidate = backends.get(i);
            try {
                String text = candidate.generate(prompt);
                log.info("Switched generation backend from {} to {}", getCurrentBackendName(), candidate.getName());
                currentIndex = i;
                return text;
            } catch (BackendCallException e) {
                log.warn("Fallback backend {} failed: {}", candidate.getName(), e.getMessage());
                lastFailure = e;
            }
        }
        String detail = lastFailure == null ? "no error details" : lastFailure.getMessage();
        throw new GenerationException("All " + backends.size() + " generation backends failed; last error: " + detail,
                lastFailure);
    }

    private CallResult call(GenerationBackend backend, String prompt) {
        try {
            return CallResult.success(backend.generate(prompt));
        } catch (BackendCallException e) {
            log.debug("Backend {} failed: {}", backend.getName(), e.getMessage());
            return CallResult.failure(classifier.classify(e), e);
        }
    }

    private void pause(long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationInterruptedException("Interrupted during backoff", e);
        }
    }
}
