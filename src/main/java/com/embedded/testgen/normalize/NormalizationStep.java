package com.embedded.testgen.normalize;

import java.util.function.BiFunction;

import com.embedded.testgen.index.FileAnalysis;

/**
 * One deterministic text rewrite. Applying a step to its own output must not change it again.
 */
public interface NormalizationStep {

    String name();

    String apply(String text, FileAnalysis source);

    static NormalizationStep of(String name, BiFunction<String, FileAnalysis, String> rewrite) {
        return new NormalizationStep() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String apply(String text, FileAnalysis source) {
                return rewrite.apply(text, source);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
