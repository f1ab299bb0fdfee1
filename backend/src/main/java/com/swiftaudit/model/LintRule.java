package com.swiftaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 审查规则描述
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LintRule {

    /** 规则唯一标识（如 control_statement） */
    private String id;

    /** 规则名称 */
    private String name;

    /** 规则描述 */
    private String description;

    /** 严重等级: ERROR, WARNING, INFO */
    private Severity severity;

    /** 是否支持自动修正 */
    private boolean correctable;

    /** 不应触发的示例代码 */
    private List<String> nonTriggeringExamples;

    /** 应触发的示例代码，↓ 标记违规位置 */
    private List<String> triggeringExamples;

    /** 自动修正示例: 原文 -> 修正后 */
    private Map<String, String> corrections;

    public enum Severity {
        ERROR, WARNING, INFO
    }
}
