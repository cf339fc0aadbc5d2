package com.protorpc.codec;

/**
 * Encoder/decoder pair for one RPC direction: values of {@code E} go out, values of
 * {@code D} come in. Clients use {@code Codec<Request, Response>}, servers
 * {@code Codec<Response, Request>}.
 *
 * Implementations carry no mutable state and may be shared across threads.
 */
public interface Codec<E, D> {

    Encoder<E> encoder();

    Decoder<D> decoder();
}
