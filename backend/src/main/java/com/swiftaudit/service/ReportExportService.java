package com.swiftaudit.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swiftaudit.model.Correction;
import com.swiftaudit.model.Location;
import com.swiftaudit.model.ScanReport;
import com.swiftaudit.model.Violation;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 扫描报告导出服务
 */
@Service
public class ReportExportService {

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ObjectMapper objectMapper;

    public ReportExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExportPayload exportMarkdown(ScanReport report) {
        byte[] content = buildMarkdown(report).getBytes(StandardCharsets.UTF_8);
        return new ExportPayload(
                "swift-audit-report-" + formatFileTs(report.getScanTime()) + ".md",
                "text/markdown;charset=UTF-8",
                content);
    }

    public ExportPayload exportJson(ScanReport report) {
        try {
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(report);
            return new ExportPayload(
                    "swift-audit-report-" + formatFileTs(report.getScanTime()) + ".json",
                    "application/json;charset=UTF-8",
                    content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON 导出失败: " + e.getMessage(), e);
        }
    }

    String buildMarkdown(ScanReport report) {
        StringBuilder md = new StringBuilder();
        md.append("# Swift 控制语句风格审查报告\n\n");
        md.append("**扫描时间:** ").append(report.getScanTime() != null ? report.getScanTime() : LocalDateTime.now()).append("\n");
        md.append("**扫描范围:** `").append(escapeInlineCode(scanScope(report))).append("`\n\n");

        if (report.isLimitReached()) {
            md.append("> ⚠️ **警告：扫描结果被截断**，违规数量达到上限，仅展示部分结果。\n\n");
        }

        List<String> notices = report.getNotices() != null ? report.getNotices() : List.of();
        if (!notices.isEmpty()) {
            md.append("## 提示\n");
            for (String notice : notices) {
                md.append("- ").append(notice).append("\n");
            }
            md.append("\n");
        }

        md.append("## 📊 统计摘要\n");
        md.append("- **扫描文件总数:** ").append(report.getTotalFiles()).append("\n");
        md.append("- **违规总数:** ").append(report.getTotalViolations())
                .append(" (❌ 错误: ").append(report.getErrorCount())
                .append(", ⚠️ 警告: ").append(report.getWarningCount())
                .append(", ℹ️ 提示: ").append(report.getInfoCount())
                .append(")\n");
        if (report.isAutocorrect()) {
            md.append("- **自动修正:** ").append(report.getTotalCorrections()).append(" 处\n");
        }
        md.append("\n");

        List<Correction> corrections = report.getCorrections() != null ? report.getCorrections() : List.of();
        if (!corrections.isEmpty()) {
            md.append("## 🔧 修正详情\n\n");
            for (Map.Entry<String, List<Correction>> entry : groupByFile(corrections, Correction::getLocation).entrySet()) {
                md.append("### 📄 `").append(escapeInlineCode(entry.getKey())).append("`\n\n");
                for (Correction c : entry.getValue()) {
                    md.append("- ").append(position(c.getLocation())).append(" ")
                            .append(orEmpty(c.getRuleName())).append(" (`").append(orEmpty(c.getRuleId())).append("`)\n");
                }
                md.append("\n");
            }
        }

        List<Violation> violations = report.getViolations() != null ? report.getViolations() : List.of();
        if (violations.isEmpty()) {
            md.append("✅ **所有控制语句均符合规范**\n");
            return md.toString();
        }

        md.append("## 🚫 违规详情\n\n");
        for (Map.Entry<String, List<Violation>> entry : groupByFile(violations, Violation::getLocation).entrySet()) {
            md.append("### 📄 `").append(escapeInlineCode(entry.getKey())).append("` (")
                    .append(entry.getValue().size()).append(" 项)\n\n");
            for (Violation v : entry.getValue()) {
                String severity = v.getSeverity() != null ? v.getSeverity().name() : "UNKNOWN";
                md.append("**[").append(severity).append("]** ").append(orEmpty(v.getRuleName()))
                        .append(" (`").append(orEmpty(v.getRuleId())).append("`)\n");
                md.append("- **位置:** ").append(position(v.getLocation())).append("\n");
                md.append("- **说明:** ").append(orEmpty(v.getMessage())).append("\n");
                if (notBlank(v.getMatchedText())) {
                    md.append("- **匹配内容:** `")
                            .append(escapeInlineCode(v.getMatchedText().replace("\n", " ")))
                            .append("`\n");
                }
                md.append("\n");
            }
        }

        List<String> files = report.getScannedFiles() != null ? report.getScannedFiles() : List.of();
        md.append("## 📁 扫描文件列表\n\n");
        for (String file : files) {
            md.append("- `").append(escapeInlineCode(file)).append("`\n");
        }
        return md.toString();
    }

    private <T> Map<String, List<T>> groupByFile(List<T> items, Function<T, Location> location) {
        Map<String, List<T>> grouped = new LinkedHashMap<>();
        for (T item : items) {
            Location loc = location.apply(item);
            String path = loc != null && notBlank(loc.getFile()) ? loc.getFile() : "unknown";
            grouped.computeIfAbsent(path, k -> new ArrayList<>()).add(item);
        }
        return grouped;
    }

    private String position(Location location) {
        if (location == null) {
            return "未知位置";
        }
        return "行 " + location.getLine() + ", 列 " + location.getCharacter();
    }

    private String scanScope(ScanReport report) {
        return notBlank(report.getRepoPath()) ? report.getRepoPath() : "源码上传模式";
    }

    private String escapeInlineCode(String text) {
        return orEmpty(text).replace("`", "\\`");
    }

    private String orEmpty(String text) {
        return text == null ? "" : text;
    }

    private boolean notBlank(String text) {
        return text != null && !text.isBlank();
    }

    private String formatFileTs(LocalDateTime time) {
        LocalDateTime effective = time != null ? time : LocalDateTime.now();
        return effective.format(FILE_TS);
    }

    public record ExportPayload(String filename, String contentType, byte[] content) {
    }
}
