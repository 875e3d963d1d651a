package com.embedded.testgen.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.embedded.testgen.validation.QualityTier;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--repo-path", "-r" }, defaultValue = ".", description = "Root of the C repository (default: current directory)")
	private Path repoPath;

	@Option(names = { "--source-dir", "-s" }, defaultValue = "src", description = "Source directory relative to the repository root (default: src)")
	private String sourceDir;

	@Option(names = { "--output", "-o" }, defaultValue = "tests", description = "Output directory relative to the repository root (default: tests)")
	private String output;

	@Option(names = { "--api-key" }, description = "Gemini API key (falls back to the GEMINI_API_KEY environment variable)")
	private String apiKey;

	@Option(names = { "--models" }, split = ",", defaultValue = "gemini-2.5-flash,gemini-2.5-pro,gemini-2.0-flash,gemini-1.5-flash,gemini-1.5-pro",
			description = "Backend models in fallback order, comma separated")
	private List<String> models;

	@Option(names = { "--base-url" }, defaultValue = "https://generativelanguage.googleapis.com", description = "Base URL of the Gemini API")
	private String baseUrl;

	@Option(names = { "--request-timeout-seconds" }, defaultValue = "120", description = "Timeout of one backend request in seconds (default: 120)")
	private int requestTimeoutSeconds;

	@Option(names = { "--max-retries" }, defaultValue = "3", description = "Tries against a throttled model before falling back (default: 3)")
	private int maxRetries;

	@Option(names = { "--backoff-ms" }, defaultValue = "1000", description = "Initial backoff after throttling, doubled per retry (default: 1000)")
	private long backoffMillis;

	// Regeneration
	@Option(names = { "--max-regeneration-attempts" }, defaultValue = "2", description = "Maximum number of regeneration attempts for low-quality tests (default: 2)")
	private int maxRegenerationAttempts;

	@Option(names = { "--regenerate-on-low-quality" }, description = "Automatically regenerate tests that are validated below the quality threshold")
	private boolean regenerateOnLowQuality;

	@Option(names = { "--quality-threshold" }, defaultValue = "HIGH", description = "Quality threshold: LOW, MEDIUM or HIGH (default: HIGH)")
	private QualityTier qualityThreshold;

	@Option(names = { "--redact-sensitive" }, description = "Redact comments, strings and credential-like content before sending source to the API")
	private boolean redactSensitive;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;
}
