package com.swiftaudit.cli;

import com.swiftaudit.model.ScanReport;
import com.swiftaudit.model.Violation;
import com.swiftaudit.service.ReportExportService;
import com.swiftaudit.service.ReportExportService.ExportPayload;
import com.swiftaudit.service.ScanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 命令行模式
 * <p>
 * 示例：
 * <pre>
 * java -jar swift-audit-backend.jar --path=./MyApp
 * java -jar swift-audit-backend.jar --path=./MyApp --fix
 * java -jar swift-audit-backend.jar --path=./MyApp --format=json --output=./report.json
 * </pre>
 * 没有 --path 参数时保持 REST API 模式。存在 ERROR 级别违规时退出码为 1。
 */
@Component
public class LintCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(LintCommandRunner.class);

    private final ScanService scanService;
    private final ReportExportService reportExportService;

    public LintCommandRunner(ScanService scanService, ReportExportService reportExportService) {
        this.scanService = scanService;
        this.reportExportService = reportExportService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("path")) {
            log.info("以 REST API 模式启动，使用 --path=<目录> 进入命令行模式");
            return;
        }

        log.info("以命令行模式启动");
        int exitCode;
        try {
            exitCode = runCli(args, System.out);
        } catch (Exception e) {
            log.error("命令行执行失败: {}", e.getMessage(), e);
            exitCode = 2;
        }
        System.exit(exitCode);
    }

    int runCli(ApplicationArguments args, PrintStream out) throws IOException {
        String path = getOption(args, "path", null);
        boolean fix = args.containsOption("fix");
        String format = getOption(args, "format", null);
        String output = getOption(args, "output", null);

        ScanReport report = scanService.scan(path, fix);

        for (Violation v : report.getViolations()) {
            out.println(formatViolation(v));
        }
        if (report.isAutocorrect()) {
            out.println("Corrected " + report.getTotalCorrections() + " occurrence(s)");
        }
        for (String notice : report.getNotices()) {
            out.println("note: " + notice);
        }
        out.println("Done linting! Found " + report.getTotalViolations() + " violation(s), "
                + report.getErrorCount() + " serious in " + report.getTotalFiles() + " file(s).");

        if (format != null) {
            ExportPayload payload = switch (format.toLowerCase()) {
                case "markdown", "md" -> reportExportService.exportMarkdown(report);
                case "json" -> reportExportService.exportJson(report);
                default -> throw new IllegalArgumentException("不支持的导出格式: " + format);
            };
            Path target = Path.of(output != null ? output : payload.filename());
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(target, payload.content());
            out.println("Report saved to: " + target.toAbsolutePath());
        }

        return report.getErrorCount() > 0 ? 1 : 0;
    }

    /**
     * 与 Xcode 兼容的输出格式: file:line:character: warning: message (rule_id)
     */
    private String formatViolation(Violation v) {
        String level = v.getSeverity() != null ? v.getSeverity().name().toLowerCase() : "warning";
        return v.getLocation().getFile() + ":" + v.getLocation().getLine() + ":" + v.getLocation().getCharacter()
                + ": " + level + ": " + v.getRuleName() + " Violation: " + v.getMessage() + " (" + v.getRuleId() + ")";
    }

    private String getOption(ApplicationArguments args, String name, String defaultValue) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return defaultValue;
        }
        return values.get(0);
    }
}
