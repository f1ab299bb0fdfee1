package com.swiftaudit.model;

import com.swiftaudit.model.LintRule.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单条违规记录
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Violation {

    /** 违反的规则标识 */
    private String ruleId;

    /** 违反的规则名称 */
    private String ruleName;

    /** 生效的严重等级 */
    private Severity severity;

    /** 违规位置（原始文本中的偏移） */
    private Location location;

    /** 触发的控制语句类型 */
    private StatementKind statementKind;

    /** 具体违规描述 */
    private String message;

    /** 违规匹配到的文本内容 */
    private String matchedText;
}
