package com.embedded.testgen.domain;

import java.util.Collection;
import java.util.Set;

import lombok.experimental.UtilityClass;

/**
 * Which headers a generated test may include.
 */
@UtilityClass
public class IncludePolicy {

    public static final String UNITY_HEADER = "unity.h";

    public static final Set<String> STANDARD_HEADERS = Set.of(
            "stdio.h", "stdlib.h", "string.h", "math.h", "assert.h", "ctype.h", "errno.h",
            "limits.h", "stdarg.h", "stddef.h", "stdint.h", "stdbool.h", "time.h", "float.h");

    /**
     * The test framework header, any header the source itself includes, and the C standard headers.
     */
    public static boolean isAllowed(String header, Collection<String> sourceIncludes) {
        return UNITY_HEADER.equals(header)
                || sourceIncludes.contains(header)
                || STANDARD_HEADERS.contains(header);
    }
}
