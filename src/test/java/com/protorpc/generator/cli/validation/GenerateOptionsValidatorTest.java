package com.protorpc.generator.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.protorpc.generator.cli.exception.OptionsValidationException;
import com.protorpc.generator.cli.model.GenerateOptions;
import com.protorpc.generator.cli.model.ValidatedGenerateOptions;
import com.protorpc.generator.codegen.GenerationOptions;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class GenerateOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private Path descriptorSet;
    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();

    @BeforeEach
    void setUp() throws IOException {
        descriptorSet = Files.write(tempDir.resolve("services.pb"), new byte[0]);
    }

    private GenerateOptions parse(String... extraArgs) {
        List<String> args = new ArrayList<>(List.of("-d", descriptorSet.toString()));
        args.addAll(Arrays.asList(extraArgs));
        return CommandLine.populateCommand(new GenerateOptions(), args.toArray(new String[0]));
    }

    @Test
    void testDefaults() {
        GenerateOptions options = parse();

        ValidatedGenerateOptions validated = validator.validate(options);

        assertThat(options.getProtoPath()).isEmpty();
        assertThat(options.getCodecPath()).isEqualTo(GenerationOptions.DEFAULT_CODEC_PATH);
        assertThat(validated.getDescriptorSets()).containsExactly(descriptorSet);
        assertThat(validated.getNormalizedOutDir())
                .isEqualTo(Path.of(GenerationOptions.DEFAULT_OUT_DIR).toAbsolutePath().normalize());
        assertThat(validated.getFileNameFn().apply("testing", "Streaming")).isEqualTo("testing_Streaming");
    }

    @Test
    void testOutDirIsNormalized() {
        Path outDir = tempDir.resolve("a/../generated");

        ValidatedGenerateOptions validated = validator.validate(parse("-o", outDir.toString()));

        assertThat(validated.getNormalizedOutDir()).isEqualTo(tempDir.resolve("generated").toAbsolutePath().normalize());
    }

    @ParameterizedTest
    @CsvSource({
        "'{package}_{service}', debugpb_Debug",
        "'{service}', Debug",
        "'{package}_{service}_tonic', debugpb_Debug_tonic"
    })
    void testFileNamePattern(String pattern, String expected) {
        assertThat(GenerateOptionsValidator.fileNameFn(pattern).apply("debugpb", "Debug")).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "testing, Streaming",
        "debugpb, Debug",
        "'', Echo"
    })
    void testDefaultPatternMatchesDefaultFileName(String packageName, String serviceName) {
        GenerateOptions options = parse();

        assertThat(options.getFileNamePattern()).isEqualTo(GenerateOptionsValidator.DEFAULT_FILE_NAME_PATTERN);
        assertThat(GenerateOptionsValidator.fileNameFn(options.getFileNamePattern()).apply(packageName, serviceName))
                .isEqualTo(GenerationOptions.DEFAULT_FILE_NAME.apply(packageName, serviceName));
    }

    @Test
    void testPatternWithoutServiceIsRejected() {
        assertThatThrownBy(() -> validator.validate(parse("--file-name-pattern", "{package}")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("{service}");
    }

    @Test
    void testCollectsAllErrors() {
        GenerateOptions options = CommandLine.populateCommand(new GenerateOptions(),
                "-d", tempDir.resolve("missing.pb").toString(),
                "--proto-path", "not a package",
                "--codec-path", "1Codec",
                "--target-package", "bad-package",
                "--module-index", "nested/modules.txt");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(5)
                        .anySatisfy(msg -> assertThat(msg).contains("missing.pb"))
                        .anySatisfy(msg -> assertThat(msg).contains("Proto path"))
                        .anySatisfy(msg -> assertThat(msg).contains("Codec path"))
                        .anySatisfy(msg -> assertThat(msg).contains("Target package"))
                        .anySatisfy(msg -> assertThat(msg).contains("Module index")));
    }

    @Test
    void testOutDirThatIsAFileIsRejected() throws IOException {
        Path file = Files.write(tempDir.resolve("taken"), new byte[] {1});

        assertThatThrownBy(() -> validator.validate(parse("-o", file.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("not a directory");
    }

    @Test
    void testClientAndServerMayBothBeDisabled() {
        GenerateOptions options = parse("--no-client", "--no-server", "--proto-path", "com.example.proto");

        assertThatCode(() -> validator.validate(options)).doesNotThrowAnyException();
        assertThat(options.isNoClient()).isTrue();
        assertThat(options.isNoServer()).isTrue();
    }

    @Test
    void testDescriptorSetIsRequired() {
        assertThatThrownBy(() -> CommandLine.populateCommand(new GenerateOptions()))
                .isInstanceOf(CommandLine.MissingParameterException.class);
    }
}
