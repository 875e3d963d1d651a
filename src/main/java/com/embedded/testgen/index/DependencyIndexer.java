package com.embedded.testgen.index;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.LoggerFactory;

/**
 * Extracts per-file function and include facts from a C source tree.
 */
public interface DependencyIndexer {

    /**
     * C source files under {@code root}, in a stable order.
     */
    List<Path> listSourceFiles(Path root) throws IOException;

    List<FunctionSignature> extractFunctions(Path file) throws IOException;

    List<String> extractIncludes(Path file) throws IOException;

    FileAnalysis analyzeFileDependencies(Path file) throws IOException;

    /**
     * Indexes every file once and freezes the result. Later definitions of a name replace earlier ones.
     * Files that cannot be read contribute no symbols; they fail later, on their own.
     */
    default SymbolTable buildSymbolTable(List<Path> files) {
        SymbolTable.Builder builder = SymbolTable.builder();
        for (Path file : files) {
            List<FunctionSignature> functions;
            try {
                functions = extractFunctions(file);
            } catch (IOException e) {
                LoggerFactory.getLogger(DependencyIndexer.class)
                        .warn("Skipping {} while indexing: {}", file.getFileName(), e.getMessage());
                continue;
            }
            for (FunctionSignature function : functions) {
                builder.define(function, file);
            }
        }
        return builder.build();
    }
}
