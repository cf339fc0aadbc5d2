package com.protorpc.codec;

import com.google.protobuf.MessageLite;
import com.google.protobuf.Parser;

/**
 * {@link Codec} for {@code application/grpc+proto} backed by protobuf-java.
 *
 * Holds only the decoded type's parser, so instances are cheap and thread-safe.
 */
public final class ProtobufCodec<E extends MessageLite, D extends MessageLite> implements Codec<E, D> {

    private final ProtobufEncoder<E> encoder = new ProtobufEncoder<>();
    private final ProtobufDecoder<D> decoder;

    public ProtobufCodec(Parser<D> parser) {
        this.decoder = new ProtobufDecoder<>(parser);
    }

    @Override
    public ProtobufEncoder<E> encoder() {
        return encoder;
    }

    @Override
    public ProtobufDecoder<D> decoder() {
        return decoder;
    }
}
