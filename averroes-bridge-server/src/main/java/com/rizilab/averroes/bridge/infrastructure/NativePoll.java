package com.rizilab.averroes.bridge.infrastructure;

/**
 * Answer of a single poll of a native future.
 */
public enum NativePoll {
    PENDING,
    READY
}
