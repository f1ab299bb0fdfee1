package com.swiftaudit.service;

import com.swiftaudit.config.LintProperties;
import com.swiftaudit.config.LintProperties.RuleConfig;
import com.swiftaudit.model.Correction;
import com.swiftaudit.model.LintRule;
import com.swiftaudit.model.LintRule.Severity;
import com.swiftaudit.model.SwiftFile;
import com.swiftaudit.model.SyntaxMap;
import com.swiftaudit.model.Violation;
import com.swiftaudit.parser.SuppressionCommentParser;
import com.swiftaudit.parser.SuppressionRegions;
import com.swiftaudit.parser.SwiftSyntaxClassifier;
import com.swiftaudit.rule.CorrectableRule;
import com.swiftaudit.rule.StyleRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 规则管理与检查服务
 */
@Service
public class RuleService {

    private static final Logger log = LoggerFactory.getLogger(RuleService.class);

    private final Map<String, StyleRule> ruleMap;
    private final LintProperties properties;
    private final SwiftSyntaxClassifier syntaxClassifier;
    private final SuppressionCommentParser suppressionParser;

    public RuleService(List<StyleRule> rules, LintProperties properties,
                       SwiftSyntaxClassifier syntaxClassifier, SuppressionCommentParser suppressionParser) {
        this.properties = properties;
        this.syntaxClassifier = syntaxClassifier;
        this.suppressionParser = suppressionParser;
        this.ruleMap = rules.stream()
                .collect(Collectors.toMap(r -> r.description().getId(), r -> r, (a, b) -> a, LinkedHashMap::new));
        log.info("加载了 {} 条规则, 其中 {} 条已启用", ruleMap.size(), enabledRules().size());
    }

    /**
     * 所有规则描述，严重等级为配置覆盖后的生效值
     */
    public List<LintRule> getAllRules() {
        return ruleMap.values().stream()
                .map(rule -> rule.description().toBuilder().severity(severityOf(rule)).build())
                .toList();
    }

    public List<LintRule> getEnabledRules() {
        return enabledRules().stream()
                .map(rule -> rule.description().toBuilder().severity(severityOf(rule)).build())
                .toList();
    }

    public Severity severityOf(StyleRule rule) {
        RuleConfig config = properties.ruleConfig(rule.description().getId());
        return config.getSeverity() != null ? config.getSeverity() : rule.description().getSeverity();
    }

    /**
     * 检查源文件，行内注释禁用的位置不报告
     */
    public List<Violation> lint(SwiftFile file) {
        SyntaxMap syntaxMap = syntaxClassifier.classify(file.getContents());
        SuppressionRegions regions = suppressionParser.parse(file.getContents(), syntaxMap);

        List<Violation> violations = new ArrayList<>();
        for (StyleRule rule : enabledRules()) {
            String ruleId = rule.description().getId();
            try {
                for (Violation v : rule.validate(file, syntaxMap, severityOf(rule))) {
                    if (regions.isEnabled(ruleId, v.getLocation().getOffset())) {
                        violations.add(v);
                    }
                }
            } catch (RuntimeException e) {
                log.warn("应用规则 {} 检查 {} 时出错: {}", ruleId, file.getRelativePath(), e.getMessage());
            }
        }
        return violations;
    }

    /**
     * 依次执行各条可修正规则。每条规则修正前重新分类，因为前一条规则可能已改写内容。
     *
     * @throws IOException 写回失败
     */
    public List<Correction> correct(SwiftFile file) throws IOException {
        List<Correction> corrections = new ArrayList<>();
        for (StyleRule rule : enabledRules()) {
            if (!(rule instanceof CorrectableRule correctable)) {
                continue;
            }
            SyntaxMap syntaxMap = syntaxClassifier.classify(file.getContents());
            SuppressionRegions regions = suppressionParser.parse(file.getContents(), syntaxMap);
            List<Correction> applied = correctable.correct(file, syntaxMap, regions);
            if (!applied.isEmpty()) {
                log.info("规则 {} 在 {} 中修正了 {} 处", rule.description().getId(), file.getRelativePath(), applied.size());
            }
            corrections.addAll(applied);
        }
        return corrections;
    }

    private List<StyleRule> enabledRules() {
        return ruleMap.values().stream()
                .filter(rule -> properties.ruleConfig(rule.description().getId()).isEnabled())
                .toList();
    }
}
