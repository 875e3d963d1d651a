package com.embedded.testgen.domain;

import java.util.List;
import java.util.regex.Pattern;

import com.embedded.testgen.index.CFunctionDefinition;
import com.embedded.testgen.index.CSourceScanner;
import com.embedded.testgen.index.CallSite;

import lombok.experimental.UtilityClass;

/**
 * Naming and structure rules of Unity test files.
 */
@UtilityClass
public class UnityConventions {

    public static final String TEST_PREFIX = "test_";
    public static final String ENTRY_POINT = "main";

    public static final Pattern UNITY_INCLUDE = Pattern.compile("#\\s*include\\s*[<\"]unity\\.h[>\"]");
    public static final Pattern EXTERN_MAIN = Pattern.compile("\\bextern\\s+int\\s+main\\s*\\(\\s*(?:void)?\\s*\\)\\s*;");

    private static final Pattern DECLARATION_PREFIX = Pattern.compile("(?:\\bextern\\s+)?\\b(?:int|void)\\s*$");

    public static boolean isTestFunction(CFunctionDefinition definition) {
        return definition.getName().startsWith(TEST_PREFIX);
    }

    public static List<CFunctionDefinition> testFunctions(String code) {
        return CSourceScanner.findFunctionDefinitions(code).stream()
                .filter(UnityConventions::isTestFunction)
                .toList();
    }

    /**
     * A {@code main} whose body starts Unity is the test runner, not a copy of the program entry point.
     */
    public static boolean isTestRunner(CFunctionDefinition definition) {
        return ENTRY_POINT.equals(definition.getName()) && definition.getBody().contains("UNITY_BEGIN");
    }

    public static boolean declaresExternMain(String code) {
        return EXTERN_MAIN.matcher(CSourceScanner.maskCommentsAndLiterals(code)).find();
    }

    /**
     * Calls of {@code main(...)} that are neither declarations nor definitions.
     */
    public static List<CallSite> entryPointCalls(String code) {
        return CSourceScanner.findCalls(code, ENTRY_POINT).stream()
                .filter(call -> !isDeclarationOrDefinition(code, call))
                .toList();
    }

    private static boolean isDeclarationOrDefinition(String code, CallSite call) {
        int lineStart = code.lastIndexOf('\n', Math.max(0, call.getStart() - 1)) + 1;
        if (call.getStart() == 0) {
            return false;
        }
        String before = code.substring(lineStart, call.getStart());
        return DECLARATION_PREFIX.matcher(before).find();
    }
}
