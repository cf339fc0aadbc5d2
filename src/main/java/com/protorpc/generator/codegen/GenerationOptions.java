package com.protorpc.generator.codegen;

import java.nio.file.Path;
import java.util.function.BiFunction;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings for one generation run.
 */
@Value
@Builder(toBuilder = true)
public class GenerationOptions {

    public static final String DEFAULT_CODEC_PATH = "com.protorpc.codec.ProtobufCodec";

    public static final String DEFAULT_OUT_DIR = "target/generated-sources/protorpc";

    /**
     * Default file naming: "{package}_{service}".
     */
    public static final BiFunction<String, String, String> DEFAULT_FILE_NAME =
            (packageName, serviceName) -> packageName + "_" + serviceName;

    /**
     * Java package prepended to every message type reference. Empty means message classes
     * live in a package named after their proto package, which is protoc's default.
     */
    @NonNull
    @Builder.Default
    String protoPath = "";

    /**
     * Codec class constructed wherever generated code needs a codec. It must implement
     * {@code com.protorpc.codec.Codec} and accept the decoded type's parser.
     */
    @NonNull
    @Builder.Default
    String codecPath = DEFAULT_CODEC_PATH;

    /**
     * Maps (package, service) to an output base name, without extension. Must be pure.
     */
    @NonNull
    @Builder.Default
    BiFunction<String, String, String> fileNameFn = DEFAULT_FILE_NAME;

    @Builder.Default
    boolean buildServer = true;

    @Builder.Default
    boolean buildClient = true;

    /**
     * Adds a channel-opening factory to generated clients.
     */
    @Builder.Default
    boolean buildTransport = true;

    @NonNull
    @Builder.Default
    Path outDir = Path.of(DEFAULT_OUT_DIR);

    @NonNull
    @Builder.Default
    String fileExtension = "java";

    /**
     * Overrides the package declared by generated files. When null the service's
     * resolved namespace is used.
     */
    String targetPackage;

    /**
     * Name of the shared module index written next to the generated files, or null to
     * skip it.
     */
    String moduleIndexFile;

    public static GenerationOptions defaults() {
        return GenerationOptions.builder().build();
    }
}
