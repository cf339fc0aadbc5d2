package com.protorpc.generator.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A service built from a descriptor set. Methods keep descriptor order.
 */
@Value
@Builder(toBuilder = true)
public class ServiceModel implements Service {

    @NonNull
    String name;

    @NonNull
    String packageName;

    @NonNull
    String protoPackage;

    @Singular
    List<MethodModel> methods;
}
