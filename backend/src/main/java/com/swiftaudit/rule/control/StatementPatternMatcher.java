package com.swiftaudit.rule.control;

import com.swiftaudit.model.StatementKind;
import com.swiftaudit.model.StatementMatch;
import com.swiftaudit.model.SyntaxMap;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按控制语句类型查找“条件被括号包裹”的候选位置
 */
@Component
public class StatementPatternMatcher {

    /** if 的捕获版本，第 1 组为括号内的条件原文 */
    static final Pattern CORRECTABLE_IF = Pattern.compile("if\\s*\\(([^,{]*)\\)\\s*\\{");

    private static final Map<StatementKind, Pattern> PATTERNS = new EnumMap<>(StatementKind.class);

    static {
        for (StatementKind kind : StatementKind.values()) {
            PATTERNS.put(kind, Pattern.compile(kind.wrappedConditionPattern()));
        }
    }

    /**
     * 扫描指定语句类型的所有候选匹配，按源码顺序返回
     */
    public List<StatementMatch> scan(String source, SyntaxMap syntaxMap, StatementKind kind) {
        return collect(PATTERNS.get(kind), source, syntaxMap, kind);
    }

    /**
     * 使用捕获版本的 if 模式扫描，结果带有条件原文
     */
    public List<StatementMatch> scanCorrectable(String source, SyntaxMap syntaxMap) {
        return collect(CORRECTABLE_IF, source, syntaxMap, StatementKind.IF);
    }

    private List<StatementMatch> collect(Pattern pattern, String source, SyntaxMap syntaxMap, StatementKind kind) {
        List<StatementMatch> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(source);
        while (matcher.find()) {
            int offset = matcher.start();
            matches.add(new StatementMatch(
                    kind,
                    offset,
                    matcher.end() - offset,
                    matcher.group(),
                    syntaxMap.kindAt(offset),
                    matcher.groupCount() >= 1 ? matcher.group(1) : null));
        }
        return matches;
    }
}
