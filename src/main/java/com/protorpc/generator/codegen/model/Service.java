package com.protorpc.generator.codegen.model;

import java.util.List;

/**
 * What the generator needs to know about a service, independent of where it came from.
 */
public interface Service {

    /**
     * Service name as declared in the schema.
     */
    String getName();

    /**
     * Single namespace segment the service resolves to.
     */
    String getPackageName();

    /**
     * Full dotted schema package, used to build the wire route. May be empty.
     */
    String getProtoPackage();

    List<? extends Method> getMethods();

    /**
     * Fully qualified service name as it appears on the wire ("pkg.sub.Service").
     */
    default String getFullName() {
        String protoPackage = getProtoPackage();
        return protoPackage == null || protoPackage.isEmpty() ? getName() : protoPackage + "." + getName();
    }
}
