package com.swiftaudit.controller;

import com.swiftaudit.model.LintRule;
import com.swiftaudit.model.ScanReport;
import com.swiftaudit.service.ReportExportService;
import com.swiftaudit.service.RuleService;
import com.swiftaudit.service.ScanService;
import com.swiftaudit.service.ScanService.CorrectionResult;
import com.swiftaudit.util.TextDecodingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Swift 风格审查 API 控制器
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class ScanController {

    private static final Logger log = LoggerFactory.getLogger(ScanController.class);

    private final ScanService scanService;
    private final RuleService ruleService;
    private final ReportExportService reportExportService;

    public ScanController(ScanService scanService, RuleService ruleService, ReportExportService reportExportService) {
        this.scanService = scanService;
        this.ruleService = ruleService;
        this.reportExportService = reportExportService;
    }

    /**
     * 扫描指定仓库路径，autocorrect=true 时就地修正
     */
    @PostMapping("/scan")
    public ResponseEntity<?> scan(@RequestBody Map<String, String> request) {
        String repoPath = request.get("repoPath");
        if (repoPath == null || repoPath.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请提供仓库路径 (repoPath)"));
        }
        boolean autocorrect = Boolean.parseBoolean(request.get("autocorrect"));

        try {
            log.info("收到扫描请求: {}, 自动修正: {}", repoPath, autocorrect);
            ScanReport report = scanService.scan(repoPath, autocorrect);
            scanService.cacheLastScanReport(report);
            return ResponseEntity.ok(report);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("扫描失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "扫描过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 上传 Swift 源文件进行审查
     */
    @PostMapping("/scan/swift")
    public ResponseEntity<?> scanSwift(@RequestParam("file") MultipartFile file) {
        String error = validateUpload(file);
        if (error != null) {
            return ResponseEntity.badRequest().body(Map.of("error", error));
        }

        String filename = file.getOriginalFilename();
        try {
            byte[] bytes = file.getBytes();
            var decoded = TextDecodingUtils.decodeBestEffort(bytes);
            log.info("收到 Swift 源码审查请求: {}, 大小: {} bytes, 编码: {}", filename, bytes.length, decoded.charsetName());

            List<String> notices = new ArrayList<>();
            String decodeNotice = decoded.buildNotice(filename);
            if (decodeNotice != null) {
                notices.add(decodeNotice);
            }

            ScanReport report = scanService.scanSwiftContent(decoded.text(), filename, notices);
            scanService.cacheLastScanReport(report);
            return ResponseEntity.ok(report);
        } catch (Exception e) {
            log.error("Swift 源码审查失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "审查过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 上传 Swift 源文件并返回自动修正后的内容
     */
    @PostMapping("/correct/swift")
    public ResponseEntity<?> correctSwift(@RequestParam("file") MultipartFile file) {
        String error = validateUpload(file);
        if (error != null) {
            return ResponseEntity.badRequest().body(Map.of("error", error));
        }

        String filename = file.getOriginalFilename();
        try {
            var decoded = TextDecodingUtils.decodeBestEffort(file.getBytes());
            log.info("收到 Swift 源码修正请求: {}", filename);
            CorrectionResult result = scanService.correctSwiftContent(decoded.text(), filename);
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            log.error("Swift 源码修正失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "修正过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 获取所有规则（严重等级为生效值）
     */
    @GetMapping("/rules")
    public ResponseEntity<List<LintRule>> getAllRules() {
        return ResponseEntity.ok(ruleService.getAllRules());
    }

    /**
     * 获取已启用的规则
     */
    @GetMapping("/rules/enabled")
    public ResponseEntity<List<LintRule>> getEnabledRules() {
        return ResponseEntity.ok(ruleService.getEnabledRules());
    }

    /**
     * 导出 Markdown 报告（优先使用请求体中的报告；未传时回退到服务端最近一次扫描结果）
     */
    @PostMapping("/report/export/markdown")
    public ResponseEntity<?> exportMarkdown(@RequestBody(required = false) ScanReport report) {
        return exportReport("markdown", report);
    }

    /**
     * 导出 JSON 报告（优先使用请求体中的报告；未传时回退到服务端最近一次扫描结果）
     */
    @PostMapping("/report/export/json")
    public ResponseEntity<?> exportJson(@RequestBody(required = false) ScanReport report) {
        return exportReport("json", report);
    }

    @GetMapping("/report/export/markdown")
    public ResponseEntity<?> exportMarkdownLatest() {
        return exportReport("markdown", null);
    }

    @GetMapping("/report/export/json")
    public ResponseEntity<?> exportJsonLatest() {
        return exportReport("json", null);
    }

    private String validateUpload(MultipartFile file) {
        if (file.isEmpty()) {
            return "请上传文件";
        }
        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase().endsWith(".swift")) {
            return "请上传 .swift 格式的源文件";
        }
        return null;
    }

    private ResponseEntity<?> exportReport(String format, ScanReport requestReport) {
        try {
            ScanReport report = resolveReportForExport(requestReport);
            if (report == null) {
                return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                        .body(Map.of("error", "暂无可导出的审查报告，请先执行一次扫描"));
            }

            ReportExportService.ExportPayload payload = "markdown".equals(format)
                    ? reportExportService.exportMarkdown(report)
                    : reportExportService.exportJson(report);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType(payload.contentType()));
            headers.setContentLength(payload.content().length);
            headers.setContentDisposition(ContentDisposition.attachment()
                    .filename(payload.filename(), StandardCharsets.UTF_8)
                    .build());
            return new ResponseEntity<>(payload.content(), headers, HttpStatus.OK);
        } catch (Exception e) {
            log.error("导出报告失败, format={}", format, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "导出失败: " + e.getMessage()));
        }
    }

    private ScanReport resolveReportForExport(ScanReport requestReport) {
        if (requestReport != null && requestReport.getScanTime() != null) {
            return requestReport;
        }
        return scanService.getLastScanReport().orElse(null);
    }
}
