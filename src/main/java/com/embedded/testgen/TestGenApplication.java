package com.embedded.testgen;

import com.embedded.testgen.cli.GenerateTestsCommand;
import picocli.CommandLine;

/**
 * Main entry point for the C unit test generator.
 * Generates Unity tests for embedded C sources through a text-generation backend,
 * validates them statically and regenerates them until they meet a quality threshold.
 */
public class TestGenApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateTestsCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
