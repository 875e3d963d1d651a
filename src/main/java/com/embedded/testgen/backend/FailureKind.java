package com.embedded.testgen.backend;

public enum FailureKind {
    /** Rate, quota or overload signal; worth waiting and retrying. */
    THROTTLING,
    /** Anything else; retrying the same request will not help. */
    OTHER
}
