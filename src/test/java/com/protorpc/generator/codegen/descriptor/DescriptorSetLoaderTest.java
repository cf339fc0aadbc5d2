package com.protorpc.generator.codegen.descriptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.protorpc.generator.codegen.GenerationException;
import com.protorpc.generator.testing.TestDescriptors;

import static org.assertj.core.api.Assertions.*;

class DescriptorSetLoaderTest {

    @TempDir
    Path tempDir;

    private final DescriptorSetLoader loader = new DescriptorSetLoader();

    @Test
    void testLoadsDescriptorSetFile() throws IOException {
        Path file = tempDir.resolve("streaming.pb");
        Files.write(file, TestDescriptors.streamingSet().toByteArray());

        FileDescriptorSet set = loader.load(file);

        assertThat(set).isEqualTo(TestDescriptors.streamingSet());
    }

    @Test
    void testLoadAllConcatenatesInArgumentOrder() throws IOException {
        Path debug = tempDir.resolve("debug.pb");
        Path streaming = tempDir.resolve("streaming.pb");
        Files.write(debug, TestDescriptors.setOf(TestDescriptors.debugFile()).toByteArray());
        Files.write(streaming, TestDescriptors.streamingSet().toByteArray());

        FileDescriptorSet set = loader.loadAll(List.of(streaming, debug));

        assertThat(set.getFileList()).extracting(FileDescriptorProto::getName)
                .containsExactly("test_streaming_rpc.proto", "debugpb.proto");
    }

    @Test
    void testMissingFile() {
        Path missing = tempDir.resolve("missing.pb");

        assertThatThrownBy(() -> loader.load(missing))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("Failed to read descriptor set");
    }

    @Test
    void testInvalidBytes() throws IOException {
        Path file = tempDir.resolve("garbage.pb");
        Files.write(file, new byte[] {0x0A, 0x05, 'a'});

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("Not a valid descriptor set");
    }
}
