package com.rizilab.averroes.bridge.domain;

import lombok.EqualsAndHashCode;

/**
 * Opaque reference to a constructed native subsystem.
 */
@EqualsAndHashCode
public final class SystemHandle {

    private final long pointer;

    public SystemHandle(long pointer) {
        if (pointer == 0L) {
            throw new IllegalArgumentException("null native handle");
        }
        this.pointer = pointer;
    }

    public long pointer() {
        return pointer;
    }

    @Override
    public String toString() {
        return "SystemHandle[0x" + Long.toHexString(pointer) + "]";
    }
}
