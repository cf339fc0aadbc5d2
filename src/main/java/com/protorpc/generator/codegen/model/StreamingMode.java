package com.protorpc.generator.codegen.model;

import io.grpc.MethodDescriptor.MethodType;

/**
 * Call shape of a method, one per combination of the two streaming flags.
 */
public enum StreamingMode {
    UNARY(MethodType.UNARY),
    CLIENT_STREAMING(MethodType.CLIENT_STREAMING),
    SERVER_STREAMING(MethodType.SERVER_STREAMING),
    BIDI_STREAMING(MethodType.BIDI_STREAMING);

    private final MethodType methodType;

    StreamingMode(MethodType methodType) {
        this.methodType = methodType;
    }

    public MethodType getMethodType() {
        return methodType;
    }

    public static StreamingMode of(boolean clientStreaming, boolean serverStreaming) {
        if (clientStreaming) {
            return serverStreaming ? BIDI_STREAMING : CLIENT_STREAMING;
        }
        return serverStreaming ? SERVER_STREAMING : UNARY;
    }
}
