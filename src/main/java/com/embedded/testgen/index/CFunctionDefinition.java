package com.embedded.testgen.index;

import lombok.Builder;
import lombok.Value;

/**
 * A function definition located in C text, with offsets into the text it was found in.
 */
@Value
@Builder
public class CFunctionDefinition {

    String name;
    String returnType;
    String parameters;
    boolean staticLinkage;

    /** Offset of the first character of the declaration prefix. */
    int start;
    /** Offset of the opening brace of the body. */
    int bodyStart;
    /** Offset one past the closing brace of the body. */
    int end;

    /** Body text between the braces, exclusive. */
    String body;

    public FunctionSignature toSignature() {
        return FunctionSignature.builder()
                .name(name)
                .returnType(returnType)
                .signature(returnType + " " + name + "(" + parameters + ")")
                .build();
    }
}
