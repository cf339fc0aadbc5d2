package com.protorpc.generator.codegen.descriptor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.InvalidProtocolBufferException;
import com.protorpc.generator.codegen.GenerationException;

/**
 * Reads binary descriptor sets written by {@code protoc --descriptor_set_out}.
 */
public class DescriptorSetLoader {
    private static final Logger log = LoggerFactory.getLogger(DescriptorSetLoader.class);

    /**
     * Loads one descriptor set file.
     *
     * @throws GenerationException if the file cannot be read or is not a descriptor set
     */
    public FileDescriptorSet load(Path path) {
        Objects.requireNonNull(path, "path");
        try (InputStream in = Files.newInputStream(path)) {
            FileDescriptorSet set = FileDescriptorSet.parseFrom(in);
            log.debug("Loaded {} file descriptor(s) from {}", set.getFileCount(), path);
            return set;
        } catch (InvalidProtocolBufferException e) {
            throw new GenerationException("Not a valid descriptor set: " + path + " (" + e.getMessage() + ")", e);
        } catch (IOException e) {
            throw new GenerationException("Failed to read descriptor set: " + path, e);
        }
    }

    /**
     * Loads several descriptor sets and concatenates their files in argument order.
     */
    public FileDescriptorSet loadAll(List<Path> paths) {
        FileDescriptorSet.Builder merged = FileDescriptorSet.newBuilder();
        for (Path path : paths) {
            merged.addAllFile(load(path).getFileList());
        }
        return merged.build();
    }
}
