package com.protorpc.codec;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.Optional;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageLite;
import com.google.protobuf.Parser;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;

/**
 * {@link Decoder} parsing the canonical protobuf encoding with the message's parser.
 */
public final class ProtobufDecoder<T extends MessageLite> implements Decoder<T> {

    private final Parser<T> parser;

    public ProtobufDecoder(Parser<T> parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    @Override
    public Optional<T> decode(ByteBuffer buf) {
        if (buf == null || !buf.hasRemaining()) {
            return Optional.empty();
        }
        try {
            // Parses a view so the caller's position is untouched.
            return Optional.of(parser.parseFrom(buf.slice()));
        } catch (InvalidProtocolBufferException e) {
            throw fromDecodeError(e);
        }
    }

    public Optional<T> decode(byte[] bytes) {
        return decode(bytes == null ? null : ByteBuffer.wrap(bytes));
    }

    /**
     * Parse failures map to INTERNAL: a well-behaved peer never sends undecodable bytes,
     * see https://github.com/grpc/grpc/blob/master/doc/statuscodes.md
     */
    static StatusRuntimeException fromDecodeError(InvalidProtocolBufferException error) {
        return Status.INTERNAL
                .withDescription(error.getMessage())
                .withCause(error)
                .asRuntimeException();
    }
}
