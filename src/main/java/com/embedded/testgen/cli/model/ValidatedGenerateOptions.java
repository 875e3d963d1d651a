package com.embedded.testgen.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateTestsCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
	Path repoPath;
	Path sourcePath;
	Path outputPath;
	String apiKey;
}
