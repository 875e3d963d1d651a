package com.embedded.testgen.regen;

/**
 * States a single file passes through while tests are generated for it.
 */
public enum RegenerationState {
    INIT,
    GENERATING,
    VALIDATING,
    DECIDING,
    REGENERATING,
    ACCEPTED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == ACCEPTED || this == EXHAUSTED;
    }
}
