package com.embedded.testgen.index;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Name, return type and full signature text of one C function definition.
 */
@Value
@Builder
public class FunctionSignature {

    @NonNull
    String name;

    /** Return type without storage-class qualifiers, e.g. {@code float} or {@code uint8_t*}. */
    @NonNull
    String returnType;

    /** Signature as written, e.g. {@code float read_temperature(int channel)}. */
    @NonNull
    String signature;
}
