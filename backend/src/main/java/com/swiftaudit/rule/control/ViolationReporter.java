package com.swiftaudit.rule.control;

import com.swiftaudit.model.LintRule;
import com.swiftaudit.model.LintRule.Severity;
import com.swiftaudit.model.Location;
import com.swiftaudit.model.StatementKind;
import com.swiftaudit.model.StatementMatch;
import com.swiftaudit.model.SwiftFile;
import com.swiftaudit.model.SyntaxMap;
import com.swiftaudit.model.Violation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 将通过误报过滤的匹配转换为违规记录
 */
@Component
public class ViolationReporter {

    private final StatementPatternMatcher matcher;
    private final ParenWrapFalsePositiveFilter falsePositiveFilter;

    public ViolationReporter(StatementPatternMatcher matcher, ParenWrapFalsePositiveFilter falsePositiveFilter) {
        this.matcher = matcher;
        this.falsePositiveFilter = falsePositiveFilter;
    }

    /**
     * 依次检查每种语句类型，同一类型内按源码顺序输出
     */
    public List<Violation> report(SwiftFile file, SyntaxMap syntaxMap, LintRule rule, Severity severity) {
        List<Violation> violations = new ArrayList<>();
        for (StatementKind kind : StatementKind.values()) {
            for (StatementMatch match : matcher.scan(file.getContents(), syntaxMap, kind)) {
                if (falsePositiveFilter.isFalsePositive(match.text(), match.leadingKind())) {
                    continue;
                }
                violations.add(Violation.builder()
                        .ruleId(rule.getId())
                        .ruleName(rule.getName())
                        .severity(severity)
                        .location(Location.of(file, match.offset()))
                        .statementKind(kind)
                        .message(kind.keyword() + " 语句的条件不应使用括号包裹")
                        .matchedText(match.text())
                        .build());
            }
        }
        return violations;
    }
}
