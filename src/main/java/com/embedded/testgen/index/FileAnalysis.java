package com.embedded.testgen.index;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Facts derived from one C source file. Immutable; recomputed for every file.
 */
@Value
@Builder(toBuilder = true)
public class FileAnalysis {

    @NonNull
    Path filePath;

    /** Raw file content as read from disk. */
    @NonNull
    String sourceText;

    @Singular
    List<FunctionSignature> functions;

    /** Identifiers called in this file that it does not define itself. */
    @Singular("calledButUndefined")
    Set<String> calledButUndefinedSymbols;

    @Singular
    List<String> includes;

    public String getFileName() {
        return filePath.getFileName().toString();
    }

    /**
     * File name without its extension, e.g. {@code sensor} for {@code sensor.c}.
     */
    public String getBaseName() {
        String name = getFileName();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public Optional<FunctionSignature> findFunction(String name) {
        return functions.stream().filter(f -> f.getName().equals(name)).findFirst();
    }

    public boolean defines(String name) {
        return findFunction(name).isPresent();
    }
}
