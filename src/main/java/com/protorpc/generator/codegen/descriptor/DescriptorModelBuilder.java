package com.protorpc.generator.codegen.descriptor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.DescriptorProtos.MethodDescriptorProto;
import com.google.protobuf.DescriptorProtos.ServiceDescriptorProto;
import com.protorpc.generator.codegen.GenerationException;
import com.protorpc.generator.codegen.GenerationOptions;
import com.protorpc.generator.codegen.model.MethodModel;
import com.protorpc.generator.codegen.model.ServiceModel;
import com.protorpc.generator.codegen.util.NamingUtil;

/**
 * Builds {@link ServiceModel}s from a descriptor set.
 *
 * Services come out in file order, then declaration order within each file. Any
 * unusable type path, or two methods of a service converting to the same generated
 * name, aborts the whole build.
 */
public class DescriptorModelBuilder {
    private static final Logger log = LoggerFactory.getLogger(DescriptorModelBuilder.class);

    private final GenerationOptions options;

    public DescriptorModelBuilder(GenerationOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public List<ServiceModel> build(FileDescriptorSet descriptorSet) {
        List<ServiceModel> services = new ArrayList<>();
        for (FileDescriptorProto file : descriptorSet.getFileList()) {
            services.addAll(buildServices(file));
        }
        log.info("Built {} service model(s) from {} file(s)", services.size(), descriptorSet.getFileCount());
        return services;
    }

    public List<ServiceModel> buildServices(FileDescriptorProto file) {
        String protoPackage = file.getPackage();
        String packageName = NamingUtil.namespaceOf(protoPackage);

        List<ServiceModel> services = new ArrayList<>();
        for (ServiceDescriptorProto svc : file.getServiceList()) {
            ServiceModel.ServiceModelBuilder service = ServiceModel.builder()
                    .name(svc.getName())
                    .packageName(packageName)
                    .protoPackage(protoPackage);
            Map<String, String> routesByName = new HashMap<>();
            for (MethodDescriptorProto method : svc.getMethodList()) {
                MethodModel model = buildMethod(svc.getName(), method);
                String clash = routesByName.putIfAbsent(model.getName(), model.getRouteName());
                if (clash != null) {
                    // Same generated method name and descriptor constant.
                    throw new GenerationException("Methods " + svc.getName() + "." + clash + " and "
                            + svc.getName() + "." + model.getRouteName() + " both generate '" + model.getName() + "'");
                }
                service.method(model);
            }
            services.add(service.build());
            log.debug("Service {} in {}: {} method(s)", svc.getName(), file.getName(), svc.getMethodCount());
        }
        return services;
    }

    private MethodModel buildMethod(String serviceName, MethodDescriptorProto method) {
        String routeName = method.getName();
        return MethodModel.builder()
                .name(NamingUtil.identifierCase(routeName))
                .routeName(routeName)
                .inputType(qualify(serviceName, routeName, "input", method.getInputType()))
                .outputType(qualify(serviceName, routeName, "output", method.getOutputType()))
                .clientStreaming(method.getClientStreaming())
                .serverStreaming(method.getServerStreaming())
                .codecPath(options.getCodecPath())
                .build();
    }

    private String qualify(String serviceName, String methodName, String role, String typePath) {
        try {
            return NamingUtil.qualifyType(typePath, options.getProtoPath());
        } catch (GenerationException e) {
            throw new GenerationException(
                    "Method " + serviceName + "." + methodName + " has an unusable " + role + " type: " + e.getMessage(), e);
        }
    }
}
