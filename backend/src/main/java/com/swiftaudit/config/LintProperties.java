package com.swiftaudit.config;

import com.swiftaudit.model.LintRule.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 审查配置
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "swift-audit")
public class LintProperties {

    /**
     * 单次扫描最多保留的违规条数
     */
    private int maxViolations = 1000;

    /**
     * 遍历仓库时跳过的目录名
     */
    private Set<String> excludedDirs = new LinkedHashSet<>(List.of(
            ".git", ".idea", ".vscode", ".build", ".swiftpm", "build",
            "Pods", "Carthage", "DerivedData", "node_modules"));

    /**
     * 按规则 id 覆盖的配置
     */
    private Map<String, RuleConfig> rules = new LinkedHashMap<>();

    public RuleConfig ruleConfig(String ruleId) {
        return rules.getOrDefault(ruleId, new RuleConfig());
    }

    @Data
    public static class RuleConfig {

        /**
         * 是否启用该规则
         */
        private boolean enabled = true;

        /**
         * 覆盖规则默认的严重等级，为空时使用规则自身的默认值
         */
        private Severity severity;
    }
}
