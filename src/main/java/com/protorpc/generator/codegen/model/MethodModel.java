package com.protorpc.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A service method built from a descriptor.
 */
@Value
@Builder(toBuilder = true)
public class MethodModel implements Method {

    /** Name in generated-source style. */
    @NonNull
    String name;

    /** Name as declared in the schema. */
    @NonNull
    String routeName;

    @NonNull
    String inputType;

    @NonNull
    String outputType;

    boolean clientStreaming;

    boolean serverStreaming;

    @NonNull
    String codecPath;
}
