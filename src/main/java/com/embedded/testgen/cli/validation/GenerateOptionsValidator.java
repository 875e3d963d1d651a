package com.embedded.testgen.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import com.embedded.testgen.cli.exception.OptionsValidationException;
import com.embedded.testgen.cli.model.GenerateOptions;
import com.embedded.testgen.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	public static final String API_KEY_ENV = "GEMINI_API_KEY";

	private final UnaryOperator<String> environment;

	public GenerateOptionsValidator() {
		this(System::getenv);
	}

	public GenerateOptionsValidator(UnaryOperator<String> environment) {
		this.environment = environment;
	}

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		Path repoPath = (o.getRepoPath() == null ? Path.of(".") : o.getRepoPath()).toAbsolutePath().normalize();
		Path sourcePath = repoPath.resolve(o.getSourceDir() == null ? "" : o.getSourceDir()).normalize();
		Path outputPath = repoPath.resolve(o.getOutput() == null ? "" : o.getOutput()).normalize();

		if (!existsDirectory(repoPath)) {
			errors.add("Repository path does not exist or is not a directory: " + repoPath);
		} else if (!existsDirectory(sourcePath)) {
			errors.add("Source directory does not exist or is not a directory: " + sourcePath);
		}
		if (Files.exists(outputPath) && !Files.isDirectory(outputPath)) {
			errors.add("Output path exists and is not a directory: " + outputPath);
		}

		String apiKey = isBlank(o.getApiKey()) ? environment.apply(API_KEY_ENV) : o.getApiKey();
		if (isBlank(apiKey)) {
			errors.add("Gemini API key is required (--api-key or the " + API_KEY_ENV + " environment variable).");
		}

		if (o.getModels() == null || o.getModels().stream().allMatch(GenerateOptionsValidator::isBlank)) {
			errors.add("At least one model is required (--models).");
		}
		if (o.getRequestTimeoutSeconds() <= 0) {
			errors.add("Request timeout must be > 0 seconds. Got: " + o.getRequestTimeoutSeconds());
		}
		if (o.getMaxRetries() < 1) {
			errors.add("Max retries must be >= 1. Got: " + o.getMaxRetries());
		}
		if (o.getBackoffMillis() < 0) {
			errors.add("Backoff must be >= 0 ms. Got: " + o.getBackoffMillis());
		}
		if (o.getMaxRegenerationAttempts() < 0) {
			errors.add("Max regeneration attempts must be >= 0. Got: " + o.getMaxRegenerationAttempts());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(repoPath, sourcePath, outputPath, apiKey.trim());
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
