package com.embedded.testgen.validation;

import com.embedded.testgen.index.FileAnalysis;
import com.embedded.testgen.index.SymbolTable;

import lombok.NonNull;
import lombok.Value;

/**
 * Everything a check may look at: the normalized test text and facts about the source under test.
 */
@Value
public class CheckInput {

    @NonNull
    String testCode;

    @NonNull
    FileAnalysis source;

    @NonNull
    SymbolTable symbols;

    public static CheckInput of(String testCode, FileAnalysis source) {
        return new CheckInput(testCode, source, SymbolTable.empty());
    }
}
