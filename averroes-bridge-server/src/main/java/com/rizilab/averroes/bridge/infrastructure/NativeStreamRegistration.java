package com.rizilab.averroes.bridge.infrastructure;

@FunctionalInterface
public interface NativeStreamRegistration {

    /**
     * Asks the core to stop the stream. No callbacks are expected afterwards, but late ones
     * must be tolerated.
     */
    void cancel();
}
