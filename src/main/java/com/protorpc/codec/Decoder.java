package com.protorpc.codec;

import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * Reads one already-delimited message.
 */
@FunctionalInterface
public interface Decoder<T> {

    /**
     * Decodes the remaining bytes of {@code buf} as exactly one message.
     *
     * @return the message, or empty when there were no bytes to decode
     * @throws io.grpc.StatusRuntimeException with code {@code INTERNAL} if the bytes are
     *         not a valid message
     */
    Optional<T> decode(ByteBuffer buf);
}
