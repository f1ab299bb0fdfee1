package com.swiftaudit.service;

import com.swiftaudit.config.LintProperties;
import com.swiftaudit.model.Correction;
import com.swiftaudit.model.LintRule.Severity;
import com.swiftaudit.model.ScanReport;
import com.swiftaudit.model.SwiftFile;
import com.swiftaudit.model.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Swift 代码仓库扫描服务
 */
@Service
public class ScanService {

    private static final Logger log = LoggerFactory.getLogger(ScanService.class);

    private static final Pattern WINDOWS_DRIVE_PATH = Pattern.compile("^[A-Za-z]:[\\\\/].*");
    private static final Pattern WSL_UNC_PATH = Pattern.compile("^//wsl(?:\\$|\\.localhost)/[^/]+(/.*)?$",
            Pattern.CASE_INSENSITIVE);

    private final RuleService ruleService;
    private final LintProperties properties;
    private final AtomicReference<ScanReport> lastScanReport = new AtomicReference<>();

    public ScanService(RuleService ruleService, LintProperties properties) {
        this.ruleService = ruleService;
        this.properties = properties;
    }

    /**
     * 扫描指定路径下的 Swift 项目
     *
     * @param autocorrect 为 true 时先自动修正并写回，再检查修正后的内容
     */
    public ScanReport scan(String repoPath, boolean autocorrect) {
        List<String> notices = new ArrayList<>();
        String resolvedRepoPath = normalizeRepoPath(repoPath, notices);

        File repoDir = resolvedRepoPath == null ? null : new File(resolvedRepoPath);
        if (repoDir == null || !repoDir.exists() || !repoDir.isDirectory()) {
            throw new IllegalArgumentException("路径不存在或不是目录: " + resolvedRepoPath);
        }

        Path repoRoot = repoDir.toPath().toAbsolutePath().normalize();
        log.info("开始扫描仓库: {} (原始输入: {}, 自动修正: {})", resolvedRepoPath, repoPath, autocorrect);

        // 1. 查找所有 Swift 源文件
        List<File> swiftFiles = new ArrayList<>();
        findSwiftFiles(repoDir, swiftFiles, new HashSet<>());
        swiftFiles.sort(Comparator.comparing(File::getPath));
        log.info("找到 {} 个 Swift 源文件", swiftFiles.size());
        if (swiftFiles.isEmpty()) {
            notices.add("未发现 .swift 源文件，请确认目录路径正确。");
        }

        // 2. 逐个文件修正、检查
        List<SwiftFile> loaded = new ArrayList<>();
        for (File file : swiftFiles) {
            try {
                loaded.add(SwiftFile.load(file.toPath().toAbsolutePath().normalize(), repoRoot));
            } catch (IOException e) {
                log.warn("无法读取文件，已跳过: {}", file.getAbsolutePath(), e);
                notices.add("无法读取文件，已跳过: " + repoRoot.relativize(file.toPath().toAbsolutePath().normalize()));
            }
        }

        ScanReport report = lintFiles(loaded, autocorrect, notices);
        report.setRepoPath(resolvedRepoPath);
        return report;
    }

    /**
     * 审查上传的 Swift 源码内容（只检查，不修正）
     *
     * @param content  源码文本
     * @param fileName 文件名
     * @return 扫描报告
     */
    public ScanReport scanSwiftContent(String content, String fileName) {
        return scanSwiftContent(content, fileName, Collections.emptyList());
    }

    public ScanReport scanSwiftContent(String content, String fileName, List<String> initialNotices) {
        log.info("开始审查 Swift 源码: {}", fileName);
        List<String> notices = new ArrayList<>();
        if (initialNotices != null) {
            notices.addAll(initialNotices);
        }
        ScanReport report = lintFiles(List.of(SwiftFile.inMemory(content, fileName)), false, notices);
        report.setRepoPath(fileName);
        return report;
    }

    /**
     * 修正上传的 Swift 源码，返回修正后的文本与修正记录
     */
    public CorrectionResult correctSwiftContent(String content, String fileName) {
        SwiftFile file = SwiftFile.inMemory(content, fileName);
        try {
            List<Correction> corrections = ruleService.correct(file);
            log.info("{} 共修正 {} 处", fileName, corrections.size());
            return new CorrectionResult(fileName, file.getContents(), corrections);
        } catch (IOException e) {
            throw new IllegalStateException("修正失败: " + e.getMessage(), e);
        }
    }

    public void cacheLastScanReport(ScanReport report) {
        lastScanReport.set(report);
    }

    public Optional<ScanReport> getLastScanReport() {
        return Optional.ofNullable(lastScanReport.get());
    }

    private ScanReport lintFiles(List<SwiftFile> files, boolean autocorrect, List<String> notices) {
        int maxViolations = properties.getMaxViolations();
        List<Violation> allViolations = new ArrayList<>();
        List<Correction> allCorrections = new ArrayList<>();
        boolean limitReached = false;

        for (SwiftFile file : files) {
            if (file.getDecodeNotice() != null) {
                notices.add(file.getDecodeNotice());
            }
            if (autocorrect) {
                try {
                    allCorrections.addAll(ruleService.correct(file));
                } catch (IOException e) {
                    log.error("写回文件失败: {}", file.getRelativePath(), e);
                    notices.add("写回失败，未修正: " + file.getRelativePath() + " (" + e.getMessage() + ")");
                }
            }
            if (limitReached) {
                continue;
            }
            for (Violation v : ruleService.lint(file)) {
                if (allViolations.size() >= maxViolations) {
                    limitReached = true;
                    break;
                }
                allViolations.add(v);
            }
        }

        if (limitReached) {
            log.warn("违规数量达到上限 {}，停止收集违规", maxViolations);
        } else {
            log.info("发现 {} 条违规, 修正 {} 处", allViolations.size(), allCorrections.size());
        }

        return ScanReport.builder()
                .scanTime(LocalDateTime.now())
                .totalFiles(files.size())
                .totalViolations(allViolations.size())
                .errorCount(countBySeverity(allViolations, Severity.ERROR))
                .warningCount(countBySeverity(allViolations, Severity.WARNING))
                .infoCount(countBySeverity(allViolations, Severity.INFO))
                .autocorrect(autocorrect)
                .totalCorrections(allCorrections.size())
                .violations(allViolations)
                .corrections(allCorrections)
                .scannedFiles(files.stream().map(SwiftFile::getRelativePath).toList())
                .notices(List.copyOf(notices))
                .limitReached(limitReached)
                .build();
    }

    private int countBySeverity(List<Violation> violations, Severity severity) {
        return (int) violations.stream().filter(v -> v.getSeverity() == severity).count();
    }

    /**
     * 递归查找 Swift 源文件
     */
    private void findSwiftFiles(File dir, List<File> result, Set<Path> visitedDirs) {
        try {
            Path dirPath = dir.toPath();
            if (Files.isSymbolicLink(dirPath)) {
                log.info("跳过符号链接目录: {}", dir.getAbsolutePath());
                return;
            }
            if (!visitedDirs.add(dirPath.toRealPath())) {
                return;
            }
        } catch (IOException e) {
            log.warn("无法访问目录，已跳过: {}", dir.getAbsolutePath(), e);
            return;
        }

        File[] files = dir.listFiles();
        if (files == null)
            return;

        for (File file : files) {
            if (file.isDirectory()) {
                if (!properties.getExcludedDirs().contains(file.getName())) {
                    findSwiftFiles(file, result, visitedDirs);
                }
            } else if (Files.isSymbolicLink(file.toPath())) {
                log.info("跳过符号链接文件: {}", file.getAbsolutePath());
            } else if (file.getName().endsWith(".swift")) {
                result.add(file);
            }
        }
    }

    private String normalizeRepoPath(String rawPath, List<String> notices) {
        if (rawPath == null) {
            return null;
        }
        String path = stripWrappingQuotes(rawPath.trim());
        if (path.isBlank()) {
            return path;
        }

        Matcher uncMatcher = WSL_UNC_PATH.matcher(path.replace('\\', '/'));
        if (uncMatcher.matches()) {
            String converted = Optional.ofNullable(uncMatcher.group(1)).filter(s -> !s.isBlank()).orElse("/");
            if (!Objects.equals(converted, path)) {
                notices.add("检测到 WSL UNC 路径，已自动转换为 Linux 路径: " + converted);
            }
            return converted;
        }

        if (WINDOWS_DRIVE_PATH.matcher(path).matches() && File.separatorChar == '/') {
            char drive = Character.toLowerCase(path.charAt(0));
            String converted = "/mnt/" + drive + path.substring(2).replace('\\', '/');
            notices.add("检测到 Windows 路径格式，已尝试自动转换为 WSL 路径: " + converted);
            return converted;
        }

        return path;
    }

    private String stripWrappingQuotes(String path) {
        if (path.length() < 2) {
            return path;
        }
        char first = path.charAt(0);
        char last = path.charAt(path.length() - 1);
        if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
            return path.substring(1, path.length() - 1);
        }
        return path;
    }

    /** 上传源码的修正结果 */
    public record CorrectionResult(String fileName, String correctedSource, List<Correction> corrections) {
    }
}
