package com.swiftaudit.rule;

import com.swiftaudit.model.TextRange;

import java.util.List;

/**
 * 规则启用状态：由行内注释等机制决定某个区间是否允许报告或修正
 */
public interface RuleEnablement {

    /**
     * 指定规则在该偏移处是否生效
     */
    boolean isEnabled(String ruleId, int offset);

    /**
     * 过滤出规则仍然生效的区间，保持原有顺序
     */
    default List<TextRange> filterEnabled(List<TextRange> ranges, String ruleId) {
        return ranges.stream()
                .filter(range -> isEnabled(ruleId, range.offset()))
                .toList();
    }

    static RuleEnablement allEnabled() {
        return (ruleId, offset) -> true;
    }
}
