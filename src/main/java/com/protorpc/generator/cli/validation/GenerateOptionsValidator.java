package com.protorpc.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.regex.Pattern;

import com.protorpc.generator.cli.exception.OptionsValidationException;
import com.protorpc.generator.cli.model.GenerateOptions;
import com.protorpc.generator.cli.model.ValidatedGenerateOptions;
import com.protorpc.generator.codegen.GenerationOptions;

public class GenerateOptionsValidator {

	public static final String PACKAGE_PLACEHOLDER = "{package}";
	public static final String SERVICE_PLACEHOLDER = "{service}";

	/** Pattern form of {@link GenerationOptions#DEFAULT_FILE_NAME}. */
	public static final String DEFAULT_FILE_NAME_PATTERN = PACKAGE_PLACEHOLDER + "_" + SERVICE_PLACEHOLDER;

	private static final Pattern QUALIFIED_NAME = Pattern
			.compile("[A-Za-z_$][A-Za-z0-9_$]*(\\.[A-Za-z_$][A-Za-z0-9_$]*)*");

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> descriptorSets = o.getDescriptorSets() == null ? List.of() : o.getDescriptorSets();
		if (descriptorSets.isEmpty()) {
			errors.add("At least one descriptor set is required (--descriptor-set / -d).");
		}
		for (Path p : descriptorSets) {
			if (!Files.isRegularFile(p)) {
				errors.add("Descriptor set does not exist or is not a file: " + p);
			}
		}

		if (!isBlank(o.getProtoPath()) && !QUALIFIED_NAME.matcher(o.getProtoPath()).matches()) {
			errors.add("Proto path must be a dotted Java package name. Got: " + o.getProtoPath());
		}
		if (isBlank(o.getCodecPath())) {
			errors.add("Codec path must not be blank (--codec-path).");
		} else if (!QUALIFIED_NAME.matcher(o.getCodecPath()).matches()) {
			errors.add("Codec path must be a fully qualified class name. Got: " + o.getCodecPath());
		}
		if (o.getTargetPackage() != null && !o.getTargetPackage().isEmpty()
				&& !QUALIFIED_NAME.matcher(o.getTargetPackage()).matches()) {
			errors.add("Target package must be a dotted Java package name. Got: " + o.getTargetPackage());
		}

		// Without {service} every service of a package would land in the same file.
		if (isBlank(o.getFileNamePattern()) || !o.getFileNamePattern().contains(SERVICE_PLACEHOLDER)) {
			errors.add("File name pattern must contain " + SERVICE_PLACEHOLDER + ". Got: " + o.getFileNamePattern());
		}

		if (o.getModuleIndex() != null) {
			Path index = Path.of(o.getModuleIndex());
			if (isBlank(o.getModuleIndex()) || index.getNameCount() != 1 || index.isAbsolute()) {
				errors.add("Module index must be a plain file name. Got: " + o.getModuleIndex());
			}
		}

		Path normalizedOutDir = (o.getOutDir() == null ? Path.of(GenerationOptions.DEFAULT_OUT_DIR) : o.getOutDir())
				.toAbsolutePath().normalize();
		if (Files.exists(normalizedOutDir) && !Files.isDirectory(normalizedOutDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutDir);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(normalizedOutDir, List.copyOf(descriptorSets),
				fileNameFn(o.getFileNamePattern()));
	}

	/**
	 * Turns a pattern such as "{package}_{service}_grpc" into a file naming function.
	 */
	public static BiFunction<String, String, String> fileNameFn(String pattern) {
		return (packageName, serviceName) -> pattern
				.replace(PACKAGE_PLACEHOLDER, packageName)
				.replace(SERVICE_PLACEHOLDER, serviceName);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
