package com.embedded.testgen.index;

import java.util.List;

import lombok.Value;

/**
 * One call expression {@code name(arg, arg, ...)} located in C text.
 * {@code end} is one past the closing parenthesis.
 */
@Value
public class CallSite {
    String name;
    int start;
    int end;
    List<String> arguments;
}
