package com.embedded.testgen.index;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NoArgsConstructor;

/**
 * {@link DependencyIndexer} backed by {@link CSourceScanner}. Good enough for
 * conventional embedded C; macros that expand into function definitions are not seen.
 */
@NoArgsConstructor
public class RegexDependencyIndexer implements DependencyIndexer {

    private static final Logger log = LoggerFactory.getLogger(RegexDependencyIndexer.class);

    private static final Pattern FUNCTION_MACRO = Pattern.compile("(?m)^\\s*#\\s*define\\s+([A-Za-z_]\\w*)\\(");

    @Override
    public List<Path> listSourceFiles(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.walk(root)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isCSourceFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    @Override
    public List<FunctionSignature> extractFunctions(Path file) throws IOException {
        return CSourceScanner.findFunctionDefinitions(read(file)).stream()
                .map(CFunctionDefinition::toSignature)
                .toList();
    }

    @Override
    public List<String> extractIncludes(Path file) throws IOException {
        return CSourceScanner.includes(read(file));
    }

    @Override
    public FileAnalysis analyzeFileDependencies(Path file) throws IOException {
        String source = read(file);
        List<CFunctionDefinition> definitions = CSourceScanner.findFunctionDefinitions(source);

        Set<String> defined = definitions.stream()
                .map(CFunctionDefinition::getName)
                .collect(Collectors.toSet());
        Set<String> macros = functionMacros(source);

        Set<String> called = new LinkedHashSet<>();
        for (CFunctionDefinition definition : definitions) {
            called.addAll(CSourceScanner.calledIdentifiers(definition.getBody()));
        }
        called.removeAll(defined);
        called.removeAll(macros);

        FileAnalysis analysis = FileAnalysis.builder()
                .filePath(file)
                .sourceText(source)
                .functions(definitions.stream().map(CFunctionDefinition::toSignature).toList())
                .calledButUndefinedSymbols(called)
                .includes(CSourceScanner.includes(source))
                .build();

        log.debug("Analyzed {}: {} functions, {} external calls, {} includes",
                file.getFileName(), analysis.getFunctions().size(),
                analysis.getCalledButUndefinedSymbols().size(), analysis.getIncludes().size());
        return analysis;
    }

    private Set<String> functionMacros(String source) {
        Matcher m = FUNCTION_MACRO.matcher(CSourceScanner.stripComments(source));
        Set<String> names = new LinkedHashSet<>();
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    private boolean isCSourceFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".c");
    }

    /**
     * Reads UTF-8, replacing malformed bytes with U+FFFD. Legacy sources often carry
     * Latin-1 characters in comments.
     */
    private String read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.warn("{} is not valid UTF-8; undecodable bytes replaced", file.getFileName());
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        }
    }
}
