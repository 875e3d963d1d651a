package com.embedded.testgen.context;

import java.util.List;
import java.util.Optional;

import com.embedded.testgen.domain.BoundedQuantity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Validation feedback carried from one attempt into the next prompt.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FeedbackSection {

    public static final int MAX_SHOWN_ISSUES = 5;

    static final String FIRST_ATTEMPT = "NONE - First generation attempt";
    static final String PREVIOUS_PASSED = "NONE - Previous attempt was successful";
    static final String HEADER = "PREVIOUS ATTEMPT FAILED WITH THESE SPECIFIC ISSUES - FIX THEM:";

    private static final FeedbackSection NONE = new FeedbackSection(true, List.of(), 0, null);

    boolean firstAttempt;
    List<String> shownIssues;
    int overflowCount;
    String correctiveInstruction;

    public static FeedbackSection none() {
        return NONE;
    }

    /**
     * Feedback from a previous attempt's issue list, in order.
     */
    public static FeedbackSection fromIssues(List<String> issues) {
        List<String> shown = List.copyOf(issues.subList(0, Math.min(MAX_SHOWN_ISSUES, issues.size())));
        int overflow = Math.max(0, issues.size() - MAX_SHOWN_ISSUES);
        return new FeedbackSection(false, shown, overflow, correctiveInstructionFor(issues).orElse(null));
    }

    public Optional<String> getCorrectiveInstruction() {
        return Optional.ofNullable(correctiveInstruction);
    }

    public boolean hasIssues() {
        return !shownIssues.isEmpty();
    }

    public String render() {
        if (firstAttempt) {
            return FIRST_ATTEMPT;
        }
        if (shownIssues.isEmpty()) {
            return PREVIOUS_PASSED;
        }
        StringBuilder sb = new StringBuilder(HEADER);
        for (String issue : shownIssues) {
            sb.append("\n- ").append(issue);
        }
        if (overflowCount > 0) {
            sb.append("\n- ... and ").append(overflowCount).append(" more issues");
        }
        if (correctiveInstruction != null) {
            sb.append("\n\n").append(correctiveInstruction);
        }
        return sb.toString();
    }

    /**
     * The instruction of the first bounded quantity named by any issue, scanning all issues,
     * not only the shown ones.
     */
    static Optional<String> correctiveInstructionFor(List<String> issues) {
        for (String issue : issues) {
            for (BoundedQuantity quantity : BoundedQuantity.values()) {
                if (quantity.matchesIssue(issue)) {
                    return Optional.of(quantity.getCorrectiveInstruction());
                }
            }
        }
        return Optional.empty();
    }
}
