package com.swiftaudit.parser;

import com.swiftaudit.rule.RuleEnablement;

import java.util.List;
import java.util.Set;

/**
 * 由 swiftlint:disable / enable 注释展开得到的启用区间。
 * 事件按偏移升序排列，某偏移之前最后一条相关事件决定规则是否生效。
 */
public class SuppressionRegions implements RuleEnablement {

    static final String ALL_RULES = "all";

    private final List<Event> events;

    SuppressionRegions(List<Event> events) {
        this.events = List.copyOf(events);
    }

    public static SuppressionRegions none() {
        return new SuppressionRegions(List.of());
    }

    @Override
    public boolean isEnabled(String ruleId, int offset) {
        boolean enabled = true;
        for (Event event : events) {
            if (event.offset() > offset) {
                break;
            }
            if (event.ruleIds().contains(ruleId) || event.ruleIds().contains(ALL_RULES)) {
                enabled = !event.disable();
            }
        }
        return enabled;
    }

    public int size() {
        return events.size();
    }

    record Event(int offset, boolean disable, Set<String> ruleIds) {
    }
}
