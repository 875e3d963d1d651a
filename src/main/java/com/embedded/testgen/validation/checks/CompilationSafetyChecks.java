package com.embedded.testgen.validation.checks;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.embedded.testgen.domain.IncludePolicy;
import com.embedded.testgen.domain.UnityConventions;
import com.embedded.testgen.index.CFunctionDefinition;
import com.embedded.testgen.index.CSourceScanner;
import com.embedded.testgen.index.FunctionSignature;
import com.embedded.testgen.validation.CheckInput;
import com.embedded.testgen.validation.CheckResult;
import com.embedded.testgen.validation.ValidationCheck;

import lombok.experimental.UtilityClass;

/**
 * Checks whose failure means the test file would not compile or link.
 */
@UtilityClass
public class CompilationSafetyChecks {

    private static final Set<String> FIXTURE_FUNCTIONS = Set.of("setUp", "tearDown", "main");

    public static List<ValidationCheck> all() {
        return List.of(
                ValidationCheck.of("unity-include", CompilationSafetyChecks::unityInclude),
                ValidationCheck.of("formatting-markers", CompilationSafetyChecks::formattingMarkers),
                ValidationCheck.of("include-allow-list", CompilationSafetyChecks::includeAllowList),
                ValidationCheck.of("duplicate-definitions", CompilationSafetyChecks::duplicateDefinitions),
                ValidationCheck.of("stub-signatures", CompilationSafetyChecks::stubSignatures),
                ValidationCheck.of("entry-point", CompilationSafetyChecks::entryPoint));
    }

    public static CheckResult unityInclude(CheckInput input) {
        if (UnityConventions.UNITY_INCLUDE.matcher(CSourceScanner.stripComments(input.getTestCode())).find()) {
            return CheckResult.passed();
        }
        return CheckResult.compileIssue("Missing required Unity include: #include \"unity.h\"");
    }

    public static CheckResult formattingMarkers(CheckInput input) {
        if (input.getTestCode().contains("```")) {
            return CheckResult.compileIssue("Contains markdown formatting markers (```) - must be pure C code");
        }
        return CheckResult.passed();
    }

    public static CheckResult includeAllowList(CheckInput input) {
        CheckResult.Builder result = CheckResult.builder();
        List<String> sourceIncludes = input.getSource().getIncludes();
        for (String header : CSourceScanner.includes(input.getTestCode())) {
            if (!IncludePolicy.isAllowed(header, sourceIncludes)) {
                result.compileIssue("Invalid include: \"" + header
                        + "\" - not included by the source file and not a standard header");
            }
        }
        return result.build();
    }

    public static CheckResult duplicateDefinitions(CheckInput input) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (CFunctionDefinition definition : CSourceScanner.findFunctionDefinitions(input.getTestCode())) {
            counts.merge(definition.getName(), 1, Integer::sum);
        }
        CheckResult.Builder result = CheckResult.builder();
        counts.forEach((name, count) -> {
            if (count > 1) {
                result.compileIssue("Duplicate function definition: " + name + "() defined " + count + " times");
            }
        });
        return result.build();
    }

    /**
     * Any non-test function in the test file that shares a name with a known source function
     * must keep that function's return type.
     */
    public static CheckResult stubSignatures(CheckInput input) {
        CheckResult.Builder result = CheckResult.builder();
        for (CFunctionDefinition definition : CSourceScanner.findFunctionDefinitions(input.getTestCode())) {
            String name = definition.getName();
            if (UnityConventions.isTestFunction(definition) || FIXTURE_FUNCTIONS.contains(name)) {
                continue;
            }
            Optional<FunctionSignature> expected = input.getSource().findFunction(name)
                    .or(() -> input.getSymbols().signatureOf(name));
            if (expected.isPresent() && !expected.get().getReturnType().equals(definition.getReturnType())) {
                result.compileIssue("Stub return type mismatch for " + name + "(): test defines '"
                        + definition.getReturnType() + "' but source declares '"
                        + expected.get().getReturnType() + "'");
            }
        }
        return result.build();
    }

    public static CheckResult entryPoint(CheckInput input) {
        String code = input.getTestCode();
        CheckResult.Builder result = CheckResult.builder();
        if (!UnityConventions.entryPointCalls(code).isEmpty() && !UnityConventions.declaresExternMain(code)) {
            result.compileIssue("main() is called without an 'extern int main(void);' declaration");
        }
        boolean redefined = CSourceScanner.findFunctionDefinitions(code).stream()
                .anyMatch(d -> UnityConventions.ENTRY_POINT.equals(d.getName()) && !UnityConventions.isTestRunner(d));
        if (redefined) {
            result.compileIssue("Test file redefines main() - declare it 'extern int main(void);' instead");
        }
        return result.build();
    }
}
