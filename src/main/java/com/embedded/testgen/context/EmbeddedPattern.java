package com.embedded.testgen.context;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import com.embedded.testgen.index.CSourceScanner;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Embedded-systems concepts recognized in a source file, each with the extra test
 * guidance added to the prompt when present.
 */
@Getter
@RequiredArgsConstructor
public enum EmbeddedPattern {

    HARDWARE_REGISTERS("Hardware registers",
            Pattern.compile("\\bvolatile\\s+\\w+\\s*\\*\\s*\\w+|\\bREG_\\w+"),
            List.of("Test volatile register reads and writes",
                    "Verify memory-mapped I/O operations",
                    "Test register bit manipulation",
                    "Check boundary conditions and invalid values")),

    BIT_FIELDS("Bit fields",
            Pattern.compile("\\b(?:unsigned|signed|int|uint\\d+_t|int\\d+_t|bool)\\s+\\w+\\s*:\\s*\\d+\\s*;|bitfield",
                    Pattern.CASE_INSENSITIVE),
            List.of("Test individual bit field access",
                    "Verify bit field packing and unpacking",
                    "Test bit field boundary conditions")),

    STATE_MACHINES("State machines",
            Pattern.compile("state", Pattern.CASE_INSENSITIVE),
            List.of("Test valid state transitions",
                    "Verify invalid transition handling",
                    "Check state machine initialization")),

    SAFETY_CRITICAL("Safety critical logic",
            Pattern.compile("safety|critical|watchdog|\\bTMR\\b|voting", Pattern.CASE_INSENSITIVE),
            List.of("Test redundancy voting with disagreeing inputs",
                    "Verify watchdog feed and timeout behavior",
                    "Test fault detection, recovery and fail-safe outputs")),

    INTERRUPT_HANDLERS("Interrupt handlers",
            Pattern.compile("\\bISR\\b|\\w+_ISR\\b|interrupt|\\bIRQ", Pattern.CASE_INSENSITIVE),
            List.of("Test ISR entry and exit conditions",
                    "Simulate interrupt flags through test-controlled variables",
                    "Test interrupt masking and unmasking")),

    DMA_OPERATIONS("DMA operations",
            Pattern.compile("\\bDMA|dma_|transfer", Pattern.CASE_INSENSITIVE),
            List.of("Test DMA channel configuration",
                    "Verify data transfer integrity",
                    "Test transfer error handling")),

    COMMUNICATION_PROTOCOLS("Communication protocols",
            Pattern.compile("protocol|\\bCAN_|\\bSPI|\\bI2C|\\bUART|serial", Pattern.CASE_INSENSITIVE),
            List.of("Verify packet parsing and validation",
                    "Check error detection such as checksums",
                    "Test timeout and retry handling"));

    private final String title;
    private final Pattern trigger;
    private final List<String> guidance;

    /**
     * Patterns whose vocabulary occurs in the code of {@code source}, comments excluded.
     */
    public static List<EmbeddedPattern> detect(String source) {
        String code = CSourceScanner.stripComments(source);
        return Arrays.stream(values())
                .filter(p -> p.trigger.matcher(code).find())
                .toList();
    }
}
