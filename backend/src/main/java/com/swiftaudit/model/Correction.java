package com.swiftaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单条自动修正记录，位置取自修改前的文本
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Correction {

    private String ruleId;

    private String ruleName;

    private Location location;
}
