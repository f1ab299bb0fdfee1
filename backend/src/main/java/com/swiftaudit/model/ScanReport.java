package com.swiftaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 扫描结果报告
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanReport {

    /** 扫描的仓库路径 */
    private String repoPath;

    /** 扫描时间 */
    private LocalDateTime scanTime;

    /** 扫描的文件总数 */
    private int totalFiles;

    /** 违规总数 */
    private int totalViolations;

    /** ERROR 级别违规数 */
    private int errorCount;

    /** WARNING 级别违规数 */
    private int warningCount;

    /** INFO 级别违规数 */
    private int infoCount;

    /** 是否执行了自动修正 */
    private boolean autocorrect;

    /** 自动修正总数 */
    private int totalCorrections;

    /** 所有违规记录 */
    private List<Violation> violations;

    /** 所有修正记录 */
    private List<Correction> corrections;

    /** 扫描的文件列表 */
    private List<String> scannedFiles;

    /** 扫描过程中的提示信息（路径转换、编码回退、写回失败等） */
    private List<String> notices;

    /** 是否因为违规过多达上限而截断 */
    private boolean limitReached;
}
