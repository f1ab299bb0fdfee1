package com.swiftaudit.rule.control;

import com.swiftaudit.model.Correction;
import com.swiftaudit.model.LintRule;
import com.swiftaudit.model.Location;
import com.swiftaudit.model.StatementMatch;
import com.swiftaudit.model.SwiftFile;
import com.swiftaudit.model.SyntaxMap;
import com.swiftaudit.model.TextRange;
import com.swiftaudit.rule.RuleEnablement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 去掉 if 条件外层多余括号的自动修正
 * <p>
 * <code>if (condition) {</code> 改写为 <code>if condition {</code>，括号内的条件文本原样保留（包括首尾空白）。
 * 修改从文件末尾往前进行，每次替换只影响其右侧内容，因此较小偏移的区间始终有效。
 */
@Component
public class CorrectionEngine {

    private static final Logger log = LoggerFactory.getLogger(CorrectionEngine.class);

    private final StatementPatternMatcher matcher;
    private final ParenWrapFalsePositiveFilter falsePositiveFilter;

    public CorrectionEngine(StatementPatternMatcher matcher, ParenWrapFalsePositiveFilter falsePositiveFilter) {
        this.matcher = matcher;
        this.falsePositiveFilter = falsePositiveFilter;
    }

    public List<Correction> correct(SwiftFile file, SyntaxMap syntaxMap, LintRule rule,
                                    RuleEnablement enablement) throws IOException {
        String source = file.getContents();

        Map<Integer, StatementMatch> candidates = new HashMap<>();
        List<TextRange> ranges = new ArrayList<>();
        for (StatementMatch match : matcher.scanCorrectable(source, syntaxMap)) {
            if (!falsePositiveFilter.isFalsePositive(match.text(), match.leadingKind())) {
                candidates.put(match.offset(), match);
                ranges.add(match.range());
            }
        }
        if (ranges.isEmpty()) {
            return List.of();
        }

        List<TextRange> eligible = enablement.filterEnabled(ranges, rule.getId()).stream()
                .filter(range -> candidates.containsKey(range.offset()))
                .sorted(Comparator.comparingInt(TextRange::offset).reversed())
                .toList();
        if (eligible.isEmpty()) {
            log.debug("{} 中的 {} 处候选均被行内注释禁用", file.getRelativePath(), ranges.size());
            return List.of();
        }

        StringBuilder contents = new StringBuilder(source);
        List<Correction> corrections = new ArrayList<>();
        for (TextRange range : eligible) {
            StatementMatch match = candidates.get(range.offset());
            corrections.add(Correction.builder()
                    .ruleId(rule.getId())
                    .ruleName(rule.getName())
                    .location(Location.of(file, range.offset()))
                    .build());
            contents.replace(range.offset(), range.end(), "if " + match.condition() + " {");
        }

        file.write(contents.toString());
        return corrections;
    }
}
