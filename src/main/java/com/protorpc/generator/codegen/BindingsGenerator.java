package com.protorpc.generator.codegen;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.protorpc.generator.codegen.descriptor.DescriptorModelBuilder;
import com.protorpc.generator.codegen.descriptor.DescriptorSetLoader;
import com.protorpc.generator.codegen.generator.ServiceGenerator;
import com.protorpc.generator.codegen.model.ServiceModel;
import com.protorpc.generator.codegen.output.ModuleIndexWriter;
import com.protorpc.generator.codegen.output.ServiceFileWriter;

/**
 * Generates gRPC bindings for every service in a descriptor set, one file per service.
 */
public class BindingsGenerator {
    private static final Logger log = LoggerFactory.getLogger(BindingsGenerator.class);

    private final GenerationOptions options;

    public BindingsGenerator(GenerationOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Loads the given descriptor set files and generates bindings for all their services.
     */
    public GeneratorResult generate(List<Path> descriptorSets) {
        FileDescriptorSet merged;
        try {
            log.info("Loading {} descriptor set(s)...", descriptorSets.size());
            merged = new DescriptorSetLoader().loadAll(descriptorSets);
        } catch (GenerationException e) {
            log.error("Generation failed: {}", e.getMessage());
            return GeneratorResult.failure(e.getMessage());
        }
        return generate(merged);
    }

    /**
     * Generates bindings for every service in {@code descriptorSet}. Stops at the first error.
     */
    public GeneratorResult generate(FileDescriptorSet descriptorSet) {
        try {
            log.info("Step 1: Building service models...");
            List<ServiceModel> services = new DescriptorModelBuilder(options).build(descriptorSet);

            log.info("Step 2: Generating bindings into {}...", options.getOutDir());
            ServiceGenerator generator = new ServiceGenerator(options);
            ServiceFileWriter writer = new ServiceFileWriter(options);

            GeneratorResult.GeneratorResultBuilder result = GeneratorResult.builder()
                    .outputDir(options.getOutDir());
            List<String> modules = new ArrayList<>();
            int methods = 0;

            for (ServiceModel service : services) {
                generator.generate(service);
                StringBuilder output = new StringBuilder();
                generator.flush(output);

                String module = writer.moduleName(service);
                if (modules.contains(module)) {
                    // Package flattening keeps only the last segment, so distinct packages can collide.
                    log.warn("Module {} was already generated in this run; {} overwrites it", module, service.getFullName());
                } else {
                    modules.add(module);
                }
                result.writtenFile(writer.write(service, module, output.toString()));
                methods += service.getMethods().size();
            }

            if (options.getModuleIndexFile() != null) {
                log.info("Step 3: Updating module index...");
                ModuleIndexWriter indexWriter = new ModuleIndexWriter(options.getOutDir(), options.getModuleIndexFile());
                result.moduleIndexPath(indexWriter.getIndexPath())
                        .moduleIndexWritten(indexWriter.writeIfChanged(modules));
            }

            return result.success(true)
                    .servicesGenerated(services.size())
                    .methodsGenerated(methods)
                    .build();

        } catch (GenerationException e) {
            log.error("Generation failed: {}", e.getMessage());
            return GeneratorResult.failure(e.getMessage());
        }
    }
}
