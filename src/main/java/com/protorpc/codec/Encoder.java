package com.protorpc.codec;

import java.io.OutputStream;

/**
 * Writes one message to a buffer supplied by the transport.
 */
@FunctionalInterface
public interface Encoder<T> {

    /**
     * Encodes {@code item} into {@code out}. Never fails for a valid message; a buffer
     * that cannot take the bytes is an environment failure and surfaces as an
     * unchecked exception, not as a status.
     */
    void encode(T item, OutputStream out);
}
