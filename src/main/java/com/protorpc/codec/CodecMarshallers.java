package com.protorpc.codec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.Objects;

import io.grpc.MethodDescriptor.Marshaller;
import io.grpc.Status;

/**
 * Adapts encoders and decoders to grpc-java marshallers.
 *
 * Each side of a call only ever uses one direction of each marshaller: a client
 * streams requests and parses responses, a server the reverse. The other direction
 * throws {@link UnsupportedOperationException}.
 */
public final class CodecMarshallers {

    private CodecMarshallers() {
        // Utility class
    }

    public static <T> Marshaller<T> encoding(Encoder<T> encoder) {
        Objects.requireNonNull(encoder, "encoder");
        return new Marshaller<T>() {
            @Override
            public InputStream stream(T value) {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                encoder.encode(value, out);
                return new ByteArrayInputStream(out.toByteArray());
            }

            @Override
            public T parse(InputStream stream) {
                throw new UnsupportedOperationException("Encode-only marshaller");
            }
        };
    }

    /**
     * @param emptyValue returned for a zero-length frame, which is how protobuf encodes a
     *        message with every field at its default
     */
    public static <T> Marshaller<T> decoding(Decoder<T> decoder, T emptyValue) {
        Objects.requireNonNull(decoder, "decoder");
        Objects.requireNonNull(emptyValue, "emptyValue");
        return new Marshaller<T>() {
            @Override
            public InputStream stream(T value) {
                throw new UnsupportedOperationException("Decode-only marshaller");
            }

            @Override
            public T parse(InputStream stream) {
                byte[] frame;
                try {
                    frame = stream.readAllBytes();
                } catch (IOException e) {
                    throw Status.INTERNAL
                            .withDescription("Failed to read message: " + e.getMessage())
                            .withCause(e)
                            .asRuntimeException();
                }
                return decoder.decode(ByteBuffer.wrap(frame)).orElse(emptyValue);
            }
        };
    }
}
