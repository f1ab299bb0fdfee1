package com.swiftaudit.rule.control;

import com.swiftaudit.model.Correction;
import com.swiftaudit.model.LintRule;
import com.swiftaudit.model.LintRule.Severity;
import com.swiftaudit.model.SwiftFile;
import com.swiftaudit.model.SyntaxMap;
import com.swiftaudit.model.Violation;
import com.swiftaudit.rule.CorrectableRule;
import com.swiftaudit.rule.RuleEnablement;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * control_statement：if、for、guard、switch、while 的条件不应使用括号包裹。
 * 只有 if 支持自动修正。
 */
@Component
public class ControlStatementRule implements CorrectableRule {

    public static final String ID = "control_statement";

    private static final LintRule DESCRIPTION = LintRule.builder()
            .id(ID)
            .name("Control Statement")
            .description("if,for,while,do statements shouldn't wrap their conditionals in parentheses.")
            .severity(Severity.WARNING)
            .correctable(true)
            .nonTriggeringExamples(List.of(
                    "if condition {\n",
                    "if (a, b) == (0, 1) {\n",
                    "if (a || b) && (c || d) {\n",
                    "if (min...max).contains(value) {\n",
                    "if renderGif(data) {\n",
                    "renderGif(data)\n",
                    "for item in collection {\n",
                    "for (key, value) in dictionary {\n",
                    "for (index, value) in enumerate(array) {\n",
                    "for var index = 0; index < 42; index++ {\n",
                    "guard condition else {\n",
                    "while condition {\n",
                    "} while condition {\n",
                    "do { ; } while condition {\n",
                    "switch foo {\n"))
            .triggeringExamples(List.of(
                    "↓if (condition) {\n",
                    "↓if(condition) {\n",
                    "↓if ((a || b) && (c || d)) {\n",
                    "↓if ((min...max).contains(value)) {\n",
                    "↓for (item in collection) {\n",
                    "↓for (var index = 0; index < 42; index++) {\n",
                    "↓for(item in collection) {\n",
                    "↓for(var index = 0; index < 42; index++) {\n",
                    "↓guard (condition) else {\n",
                    "↓while (condition) {\n",
                    "↓while(condition) {\n",
                    "} ↓while (condition) {\n",
                    "} ↓while(condition) {\n",
                    "do { ; } ↓while(condition) {\n",
                    "do { ; } ↓while (condition) {\n",
                    "↓switch (foo) {\n"))
            .corrections(corrections())
            .build();

    private final ViolationReporter violationReporter;
    private final CorrectionEngine correctionEngine;

    public ControlStatementRule(ViolationReporter violationReporter, CorrectionEngine correctionEngine) {
        this.violationReporter = violationReporter;
        this.correctionEngine = correctionEngine;
    }

    @Override
    public LintRule description() {
        return DESCRIPTION;
    }

    @Override
    public List<Violation> validate(SwiftFile file, SyntaxMap syntaxMap, Severity severity) {
        return violationReporter.report(file, syntaxMap, DESCRIPTION, severity);
    }

    @Override
    public List<Correction> correct(SwiftFile file, SyntaxMap syntaxMap, RuleEnablement enablement) throws IOException {
        return correctionEngine.correct(file, syntaxMap, DESCRIPTION, enablement);
    }

    private static Map<String, String> corrections() {
        Map<String, String> corrections = new LinkedHashMap<>();
        corrections.put("if (condition) {}\n", "if condition {}\n");
        corrections.put("if ((a || b) && (c || d)) {}\n", "if (a || b) && (c || d) {}\n");
        corrections.put("if ((min...max).contains(value)) {\n", "if (min...max).contains(value) {\n");
        return corrections;
    }
}
