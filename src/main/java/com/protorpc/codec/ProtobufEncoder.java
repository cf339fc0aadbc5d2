package com.protorpc.codec;

import java.io.IOException;
import java.io.OutputStream;

import com.google.protobuf.MessageLite;

/**
 * {@link Encoder} writing the canonical protobuf encoding of a message.
 */
public final class ProtobufEncoder<T extends MessageLite> implements Encoder<T> {

    @Override
    public void encode(T item, OutputStream out) {
        try {
            item.writeTo(out);
        } catch (IOException e) {
            throw new IllegalStateException("Message only fails to encode if the buffer runs out of space", e);
        }
    }

    public byte[] encode(T item) {
        return item.toByteArray();
    }
}
