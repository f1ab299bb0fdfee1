package com.swiftaudit.service;

import com.swiftaudit.config.LintProperties;
import com.swiftaudit.model.ScanReport;
import com.swiftaudit.parser.SuppressionCommentParser;
import com.swiftaudit.parser.SwiftSyntaxClassifier;
import com.swiftaudit.rule.control.ControlStatementRule;
import com.swiftaudit.rule.control.CorrectionEngine;
import com.swiftaudit.rule.control.ParenWrapFalsePositiveFilter;
import com.swiftaudit.rule.control.StatementPatternMatcher;
import com.swiftaudit.rule.control.ViolationReporter;
import com.swiftaudit.service.ScanService.CorrectionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScanServiceTest {

    @TempDir
    Path tempDir;

    private LintProperties properties;
    private ScanService scanService;

    @BeforeEach
    void setUp() throws Exception {
        StatementPatternMatcher matcher = new StatementPatternMatcher();
        ParenWrapFalsePositiveFilter filter = new ParenWrapFalsePositiveFilter();
        ControlStatementRule rule = new ControlStatementRule(
                new ViolationReporter(matcher, filter),
                new CorrectionEngine(matcher, filter));
        properties = new LintProperties();
        RuleService ruleService = new RuleService(List.of(rule), properties,
                new SwiftSyntaxClassifier(), new SuppressionCommentParser());
        scanService = new ScanService(ruleService, properties);

        Path app = Files.createDirectories(tempDir.resolve("Sources/App"));
        Files.writeString(app.resolve("Main.swift"), "if (ready) {\n    start()\n}\n");
        Files.writeString(app.resolve("Clean.swift"), "if ready {}\n");
        Files.writeString(app.resolve("README.md"), "if (a) {}\n");
        Path generated = Files.createDirectories(tempDir.resolve(".build/debug"));
        Files.writeString(generated.resolve("Generated.swift"), "if (x) {}\n");
    }

    @Test
    void shouldScanSwiftFilesAndSkipExcludedDirectories() {
        ScanReport report = scanService.scan(tempDir.toString(), false);

        assertEquals(2, report.getTotalFiles());
        assertEquals(1, report.getTotalViolations());
        assertEquals(1, report.getWarningCount());
        assertEquals(0, report.getErrorCount());
        assertFalse(report.isAutocorrect());
        assertTrue(report.getCorrections().isEmpty());
        String main = Path.of("Sources", "App", "Main.swift").toString();
        assertTrue(report.getScannedFiles().contains(main));
        assertEquals(main, report.getViolations().get(0).getLocation().getFile());
        assertEquals(1, report.getViolations().get(0).getLocation().getLine());
    }

    @Test
    void shouldCorrectFilesOnDiskBeforeLinting() throws Exception {
        ScanReport report = scanService.scan(tempDir.toString(), true);

        assertTrue(report.isAutocorrect());
        assertEquals(1, report.getTotalCorrections());
        assertEquals(0, report.getTotalViolations());
        assertEquals("if ready {\n    start()\n}\n",
                Files.readString(tempDir.resolve("Sources/App/Main.swift")));
        assertEquals("if (x) {}\n", Files.readString(tempDir.resolve(".build/debug/Generated.swift")));
    }

    @Test
    void shouldKeepByteOrderMarkWhenWritingBack() throws Exception {
        Path file = tempDir.resolve("Sources/App/Bom.swift");
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] body = "if (a) {}\n".getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, content, 0, bom.length);
        System.arraycopy(body, 0, content, bom.length, body.length);
        Files.write(file, content);

        scanService.scan(tempDir.toString(), true);

        byte[] written = Files.readAllBytes(file);
        assertArrayEquals(bom, Arrays.copyOf(written, 3));
        assertEquals("if a {}\n", new String(written, 3, written.length - 3, StandardCharsets.UTF_8));
    }

    @Test
    void shouldReportWriteFailureAndContinueWithNextFile() throws Exception {
        Path broken = tempDir.resolve("Sources/App/Broken.swift");
        byte[] original = {'i', 'f', ' ', '(', 'a', ')', ' ', '{', '}', '\n', '/', '/', ' ', (byte) 0xFF, '\n'};
        Files.write(broken, original);
        Files.writeString(tempDir.resolve("Sources/App/Zed.swift"), "if (z) {}\n");

        ScanReport report = scanService.scan(tempDir.toString(), true);

        String brokenName = Path.of("Sources", "App", "Broken.swift").toString();
        assertTrue(report.getNotices().stream().anyMatch(n -> n.startsWith("写回失败，未修正: " + brokenName)));
        assertArrayEquals(original, Files.readAllBytes(broken));
        assertEquals(1, report.getTotalViolations());
        assertEquals(brokenName, report.getViolations().get(0).getLocation().getFile());
        assertEquals(0, report.getViolations().get(0).getLocation().getOffset());

        assertEquals(2, report.getTotalCorrections());
        assertEquals("if z {}\n", Files.readString(tempDir.resolve("Sources/App/Zed.swift")));
        assertEquals("if ready {\n    start()\n}\n", Files.readString(tempDir.resolve("Sources/App/Main.swift")));
    }

    @Test
    void shouldRejectMissingDirectory() {
        assertThrows(IllegalArgumentException.class,
                () -> scanService.scan(tempDir.resolve("missing").toString(), false));
        assertThrows(IllegalArgumentException.class, () -> scanService.scan("  ", false));
    }

    @Test
    void shouldAcceptQuotedPath() {
        ScanReport report = scanService.scan("\"" + tempDir + "\"", false);

        assertEquals(tempDir.toString(), report.getRepoPath());
        assertEquals(2, report.getTotalFiles());
    }

    @Test
    void shouldStopCollectingAtViolationLimit() throws Exception {
        properties.setMaxViolations(1);
        Files.writeString(tempDir.resolve("Sources/App/More.swift"), "while (a) {}\nswitch (b) {}\n");

        ScanReport report = scanService.scan(tempDir.toString(), false);

        assertTrue(report.isLimitReached());
        assertEquals(1, report.getTotalViolations());
    }

    @Test
    void shouldLintUploadedContent() {
        ScanReport report = scanService.scanSwiftContent("guard (ok) else { return }\n", "Upload.swift",
                List.of("note"));

        assertEquals("Upload.swift", report.getRepoPath());
        assertEquals(1, report.getTotalFiles());
        assertEquals(1, report.getTotalViolations());
        assertEquals(List.of("note"), report.getNotices());
    }

    @Test
    void shouldCorrectUploadedContent() {
        CorrectionResult result = scanService.correctSwiftContent("if (a) {}\nif (b) {}\n", "Upload.swift");

        assertEquals("if a {}\nif b {}\n", result.correctedSource());
        assertEquals(2, result.corrections().size());
        assertEquals("Upload.swift", result.fileName());
    }

    @Test
    void shouldCacheLastReport() {
        assertTrue(scanService.getLastScanReport().isEmpty());

        ScanReport report = scanService.scanSwiftContent("if a {}\n", "Upload.swift");
        scanService.cacheLastScanReport(report);

        assertSame(report, scanService.getLastScanReport().orElseThrow());
    }
}
