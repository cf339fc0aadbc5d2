package com.protorpc.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.protorpc.generator.cli.validation.GenerateOptionsValidator;
import com.protorpc.generator.codegen.GenerationOptions;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--descriptor-set", "-d" }, required = true, arity = "1..*",
			description = "Descriptor set file(s) written by protoc --descriptor_set_out")
	private List<Path> descriptorSets;

	@Option(names = { "--out-dir", "-o" },
			description = "Output directory (default: " + GenerationOptions.DEFAULT_OUT_DIR + ")")
	private Path outDir;

	@Option(names = { "--proto-path" }, defaultValue = "",
			description = "Java package prepended to message type references (default: none)")
	private String protoPath;

	@Option(names = { "--codec-path" }, defaultValue = GenerationOptions.DEFAULT_CODEC_PATH,
			description = "Codec class constructed by generated code (default: ${DEFAULT-VALUE})")
	private String codecPath;

	@Option(names = { "--file-name-pattern" }, defaultValue = GenerateOptionsValidator.DEFAULT_FILE_NAME_PATTERN,
			description = "Output file base name; {package} and {service} are substituted (default: ${DEFAULT-VALUE})")
	private String fileNamePattern;

	@Option(names = { "--target-package" },
			description = "Package declared by generated files (default: last segment of the proto package)")
	private String targetPackage;

	@Option(names = { "--module-index" },
			description = "Name of an index file listing generated modules, rewritten only when it changes")
	private String moduleIndex;

	@Option(names = { "--no-client" }, description = "Skip client generation")
	private boolean noClient;

	@Option(names = { "--no-server" }, description = "Skip server generation")
	private boolean noServer;

	@Option(names = { "--no-transport" }, description = "Do not add channel-opening helpers to clients")
	private boolean noTransport;

}
