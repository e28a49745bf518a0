package com.mike.contactenricher.sink;

public enum FailureClass {
    /** Connection loss, timeouts: worth retrying. */
    TRANSIENT,
    /** Constraint violations: retrying cannot help. */
    INTEGRITY,
    OTHER
}
