package com.swiftaudit.rule;

import com.swiftaudit.model.LintRule;
import com.swiftaudit.model.LintRule.Severity;
import com.swiftaudit.model.SwiftFile;
import com.swiftaudit.model.SyntaxMap;
import com.swiftaudit.model.Violation;

import java.util.List;

/**
 * Swift 风格规则接口
 */
public interface StyleRule {

    /**
     * 规则描述，id 对应配置项 swift-audit.rules 的键
     */
    LintRule description();

    /**
     * 检查源文件，返回违规列表；没有违规时返回空列表。只读，不修改文件。
     *
     * @param severity 本次检查生效的严重等级，原样写入每条违规
     */
    List<Violation> validate(SwiftFile file, SyntaxMap syntaxMap, Severity severity);
}
