package com.swiftaudit.cli;

import com.swiftaudit.model.LintRule.Severity;
import com.swiftaudit.model.Location;
import com.swiftaudit.model.ScanReport;
import com.swiftaudit.model.Violation;
import com.swiftaudit.service.ReportExportService;
import com.swiftaudit.service.ReportExportService.ExportPayload;
import com.swiftaudit.service.ScanService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LintCommandRunnerTest {

    @TempDir
    Path tempDir;

    private ScanService scanService;
    private ReportExportService reportExportService;
    private LintCommandRunner runner;
    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        scanService = mock(ScanService.class);
        reportExportService = mock(ReportExportService.class);
        runner = new LintCommandRunner(scanService, reportExportService);
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private ScanReport report(Severity severity, boolean autocorrect) {
        Violation violation = Violation.builder()
                .ruleId("control_statement")
                .ruleName("Control Statement")
                .severity(severity)
                .message("if 语句的条件不应使用括号包裹")
                .location(Location.builder().file("Sources/Main.swift").line(3).character(5).offset(20).build())
                .build();
        return ScanReport.builder()
                .totalFiles(1)
                .totalViolations(1)
                .errorCount(severity == Severity.ERROR ? 1 : 0)
                .warningCount(severity == Severity.WARNING ? 1 : 0)
                .autocorrect(autocorrect)
                .totalCorrections(autocorrect ? 2 : 0)
                .violations(List.of(violation))
                .notices(List.of())
                .build();
    }

    @Test
    void shouldPrintViolationsInXcodeFormat() throws Exception {
        when(scanService.scan("/repo", false)).thenReturn(report(Severity.WARNING, false));

        int exitCode = runner.runCli(new DefaultApplicationArguments("--path=/repo"), out);

        String printed = buffer.toString(StandardCharsets.UTF_8);
        assertEquals(0, exitCode);
        assertTrue(printed.contains("Sources/Main.swift:3:5: warning: Control Statement Violation"));
        assertTrue(printed.contains("(control_statement)"));
        assertTrue(printed.contains("Found 1 violation(s), 0 serious in 1 file(s)."));
    }

    @Test
    void shouldFailOnErrorsAndReportCorrections() throws Exception {
        when(scanService.scan("/repo", true)).thenReturn(report(Severity.ERROR, true));

        int exitCode = runner.runCli(new DefaultApplicationArguments("--path=/repo", "--fix"), out);

        assertEquals(1, exitCode);
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("Corrected 2 occurrence(s)"));
    }

    @Test
    void shouldWriteExportedReport() throws Exception {
        ScanReport report = report(Severity.WARNING, false);
        when(scanService.scan("/repo", false)).thenReturn(report);
        when(reportExportService.exportMarkdown(report)).thenReturn(new ExportPayload(
                "report.md", "text/markdown", "# report".getBytes(StandardCharsets.UTF_8)));
        Path output = tempDir.resolve("out/report.md");

        runner.runCli(new DefaultApplicationArguments("--path=/repo", "--format=markdown", "--output=" + output), out);

        assertEquals("# report", Files.readString(output));
    }

    @Test
    void shouldRejectUnknownFormat() {
        when(scanService.scan("/repo", false)).thenReturn(report(Severity.WARNING, false));

        assertThrows(IllegalArgumentException.class,
                () -> runner.runCli(new DefaultApplicationArguments("--path=/repo", "--format=xml"), out));
    }
}
