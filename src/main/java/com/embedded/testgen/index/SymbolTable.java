package com.embedded.testgen.index;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Function name to owning file, built once per run and read-only afterwards.
 * <p>
 * When several files define the same name, the last file indexed owns it and the
 * name is reported by {@link #getAmbiguousNames()}.
 */
public final class SymbolTable {

    private static final SymbolTable EMPTY = new SymbolTable(Map.of(), Set.of());

    private final Map<String, Entry> entries;
    private final Set<String> ambiguousNames;

    private SymbolTable(Map<String, Entry> entries, Set<String> ambiguousNames) {
        this.entries = entries;
        this.ambiguousNames = ambiguousNames;
    }

    public static SymbolTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Path> ownerOf(String name) {
        return Optional.ofNullable(entries.get(name)).map(Entry::getOwner);
    }

    public Optional<FunctionSignature> signatureOf(String name) {
        return Optional.ofNullable(entries.get(name)).map(Entry::getSignature);
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public Set<String> getNames() {
        return entries.keySet();
    }

    public Set<String> getAmbiguousNames() {
        return ambiguousNames;
    }

    public int size() {
        return entries.size();
    }

    @Value
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    public static class Entry {
        FunctionSignature signature;
        Path owner;
    }

    /**
     * Single-use builder. Definitions are applied in call order.
     */
    public static final class Builder {

        private static final Logger log = LoggerFactory.getLogger(SymbolTable.class);

        private final Map<String, Entry> entries = new LinkedHashMap<>();
        private final Set<String> ambiguous = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder define(FunctionSignature signature, Path owner) {
            Entry previous = entries.put(signature.getName(), new Entry(signature, owner));
            if (previous != null && !previous.getOwner().equals(owner)) {
                ambiguous.add(signature.getName());
                log.debug("Function {} defined in both {} and {}; using {}",
                        signature.getName(), previous.getOwner(), owner, owner);
            }
            return this;
        }

        public SymbolTable build() {
            return new SymbolTable(
                    Collections.unmodifiableMap(new LinkedHashMap<>(entries)),
                    Collections.unmodifiableSet(new LinkedHashSet<>(ambiguous)));
        }
    }
}
