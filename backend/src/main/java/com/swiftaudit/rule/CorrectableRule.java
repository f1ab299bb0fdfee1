package com.swiftaudit.rule;

import com.swiftaudit.model.Correction;
import com.swiftaudit.model.SwiftFile;
import com.swiftaudit.model.SyntaxMap;

import java.io.IOException;
import java.util.List;

/**
 * 支持自动修正的规则
 */
public interface CorrectableRule extends StyleRule {

    /**
     * 修正源文件并写回，返回修正记录。没有可修正内容时不写文件并返回空列表。
     *
     * @throws IOException 写回失败，此时不返回任何修正记录
     */
    List<Correction> correct(SwiftFile file, SyntaxMap syntaxMap, RuleEnablement enablement) throws IOException;
}
