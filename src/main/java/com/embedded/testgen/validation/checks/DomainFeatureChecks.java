package com.embedded.testgen.validation.checks;

import java.util.List;
import java.util.regex.Pattern;

import com.embedded.testgen.index.CSourceScanner;
import com.embedded.testgen.validation.CheckInput;
import com.embedded.testgen.validation.CheckResult;
import com.embedded.testgen.validation.ValidationCheck;

import lombok.experimental.UtilityClass;

/**
 * Embedded-specific coverage: when the source shows a feature, the tests must exercise it.
 * Every check here is a (source trigger, required test evidence, issue) triple.
 */
@UtilityClass
public class DomainFeatureChecks {

    private static final int CI = Pattern.CASE_INSENSITIVE;

    public static List<ValidationCheck> all() {
        return List.of(
                feature("volatile-coverage",
                        Pattern.compile("\\bvolatile\\b"),
                        Pattern.compile("\\bvolatile\\b"),
                        "Source uses volatile variables but tests don't verify volatile behavior"),
                feature("bitfield-coverage",
                        Pattern.compile("\\b(?:unsigned|signed|int|char|short|long|bool|_Bool|u?int\\d+_t)\\s+\\w+\\s*:\\s*\\d+\\s*[;,]"),
                        Pattern.compile("<<|>>|&|\\||~|\\^"),
                        "Source has bit fields but tests don't verify bit operations"),
                feature("state-machine-coverage",
                        Pattern.compile("\\bstate\\b|\\bSTATE_\\w+|\\w_state\\b|\\bstate_\\w+", CI),
                        Pattern.compile("transition|state_change|next_state", CI),
                        "State machine detected but no state transition tests found"),
                feature("redundancy-voting-coverage",
                        Pattern.compile("\\btmr\\b|triple|voting|majority", CI),
                        Pattern.compile("aaa|aab|abc|fault|disagree", CI),
                        "TMR/voting logic detected but no fault injection or disagreement tests"),
                feature("watchdog-coverage",
                        Pattern.compile("watchdog|\\bwdt|timeout|\\bfeed", CI),
                        Pattern.compile("timeout|feed|reset_prevent", CI),
                        "Watchdog functionality detected but no timeout or feed tests"),
                feature("hardware-interaction-coverage",
                        Pattern.compile("\\bdma|interrupt|\\birq|_irq|\\bisr\\b|_isr\\b", CI),
                        Pattern.compile("register|peripheral|mock|stub", CI),
                        "Interrupt/DMA functionality detected but no hardware simulation in tests"),
                feature("register-access-coverage",
                        Pattern.compile("\\bmmio\\b|memory[\\s_-]*map|register\\w*[^\\n]*0x[0-9a-f]+|volatile\\s+uint32_t\\s*\\*", CI),
                        Pattern.compile("\\|=|&=|\\^=|\\bread\\w*\\s*\\(|\\bwrite\\w*\\s*\\(|\\bREG_\\w+", CI),
                        "Memory-mapped register access detected but no register read/write tests"));
    }

    static ValidationCheck feature(String name, Pattern sourceTrigger, Pattern testEvidence, String issue) {
        return ValidationCheck.of(name, input -> {
            String source = CSourceScanner.stripComments(input.getSource().getSourceText());
            if (!sourceTrigger.matcher(source).find()) {
                return CheckResult.passed();
            }
            String test = CSourceScanner.stripComments(input.getTestCode());
            return testEvidence.matcher(test).find() ? CheckResult.passed() : CheckResult.issue(issue);
        });
    }
}
