package com.protorpc.generator.codegen.model;

/**
 * What the generator needs to know about a service method.
 */
public interface Method {

    /**
     * Identifier used for the method in generated source.
     */
    String getName();

    /**
     * Method name exactly as declared in the schema. Routes calls on the wire.
     */
    String getRouteName();

    /**
     * Class of the codec constructed for this method.
     */
    String getCodecPath();

    String getInputType();

    String getOutputType();

    boolean isClientStreaming();

    boolean isServerStreaming();

    default StreamingMode getStreamingMode() {
        return StreamingMode.of(isClientStreaming(), isServerStreaming());
    }
}
