package app;

import domain.convert.ConversionCoordinator;
import domain.mapping.MethodNameMapper;
import domain.model.ConversionJob;
import domain.model.ConversionWarning;
import domain.model.FileConversionResult;
import domain.model.ListConversionWarningSink;
import domain.model.WarningCode;
import infra.output.FileConvertedCodeWriter;
import infra.output.NullConvertedCodeWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchConversionRunnerTest {

    @TempDir
    Path tempDir;

    private final ConversionCoordinator coordinator = ConversionCoordinator.createDefault(MethodNameMapper.builtIn());

    private ConversionJob job(String name, String content, String source, String target) throws Exception {
        Path p = tempDir.resolve("src").resolve(name);
        if (content != null) {
            Files.createDirectories(p.getParent());
            Files.writeString(p, content, StandardCharsets.UTF_8);
        }
        return new ConversionJob(name, p, source, target, null);
    }

    private static boolean hasCode(List<ConversionWarning> warnings, WarningCode code, String file) {
        return warnings.stream().anyMatch(w -> w.getCode() == code && w.getSourceFile().equals(file));
    }

    @Test
    void should_keep_going_and_classify_every_row() throws Exception {
        List<ConversionJob> jobs = List.of(
                job("ok.py", "x = 1\nprint(x)\n", "python", "javascript"),
                job("empty.py", "  \n", "python", "javascript"),
                job("missing.py", null, "python", "javascript"),
                job("notes.txt", "hello world\n", null, "python"),
                job("detected.js", "const x = 1;\nconsole.log(x);\n", null, "python"),
                job("pair.py", "x = 1\n", "python", "java"));

        Path outDir = tempDir.resolve("out");
        List<ConversionWarning> warnings = new ArrayList<>();
        BatchConversionRunner.Report report = new BatchConversionRunner(coordinator, new FileConvertedCodeWriter(),
                outDir, 0.5, false, 2, 0).run(jobs, new ListConversionWarningSink(warnings));

        List<FileConversionResult> rows = report.getResults();
        assertEquals(6, rows.size());

        assertEquals(FileConversionResult.STATUS_OK, rows.get(0).getStatus());
        assertEquals(outDir.resolve("ok.js").toString(), rows.get(0).getOutputFile());
        assertEquals("let x = 1;\nconsole.log(x);\n",
                Files.readString(outDir.resolve("ok.js"), StandardCharsets.UTF_8));

        assertEquals(FileConversionResult.STATUS_SKIP, rows.get(1).getStatus());
        assertEquals("SOURCE_EMPTY", rows.get(1).getMessage());
        assertTrue(hasCode(warnings, WarningCode.SOURCE_EMPTY, "empty.py"));

        assertEquals(FileConversionResult.STATUS_FAIL, rows.get(2).getStatus());
        assertEquals("SOURCE_NOT_FOUND", rows.get(2).getMessage());
        assertTrue(hasCode(warnings, WarningCode.SOURCE_READ_FAILED, "missing.py"));

        assertEquals(FileConversionResult.STATUS_SKIP, rows.get(3).getStatus());
        assertEquals("LANGUAGE_NOT_DETECTED", rows.get(3).getMessage());
        assertTrue(hasCode(warnings, WarningCode.LANGUAGE_NOT_DETECTED, "notes.txt"));

        FileConversionResult detected = rows.get(4);
        assertEquals(FileConversionResult.STATUS_OK, detected.getStatus());
        assertTrue(detected.isDetected());
        assertEquals("javascript", detected.getSourceLanguage());
        assertTrue(Files.exists(outDir.resolve("detected.py")));

        assertEquals(FileConversionResult.STATUS_FAIL, rows.get(5).getStatus());
        assertEquals("UNSUPPORTED_PAIR", rows.get(5).getMessage());
        assertTrue(hasCode(warnings, WarningCode.UNSUPPORTED_PAIR, "pair.py"));

        assertEquals(2, report.getOk());
        assertEquals(0, report.getLowConfidence());
        assertEquals(2, report.getSkip());
        assertEquals(2, report.getFail());
    }

    @Test
    void should_mark_rows_below_threshold_as_low_confidence() throws Exception {
        List<ConversionJob> jobs = List.of(job("ok.py", "x = 1\n", "python", "javascript"));
        List<ConversionWarning> warnings = new ArrayList<>();

        BatchConversionRunner.Report report = new BatchConversionRunner(coordinator, new NullConvertedCodeWriter(),
                null, 1.01, false, 50, 0).run(jobs, new ListConversionWarningSink(warnings));

        assertEquals(FileConversionResult.STATUS_LOW_CONFIDENCE, report.getResults().get(0).getStatus());
        assertEquals("", report.getResults().get(0).getOutputFile());
        assertEquals(1, report.getLowConfidence());
        assertTrue(hasCode(warnings, WarningCode.LOW_CONFIDENCE, "ok.py"));
    }

    @Test
    void should_report_unsupported_constructs_and_strict_violation() throws Exception {
        ConversionJob strictJob = new ConversionJob("cls.py", tempDir.resolve("cls.py"), "python", "javascript", true);
        Files.writeString(strictJob.getPath(), "class Foo:\n    pass\n", StandardCharsets.UTF_8);
        List<ConversionWarning> warnings = new ArrayList<>();

        BatchConversionRunner.Report report = new BatchConversionRunner(coordinator, new NullConvertedCodeWriter(),
                null, 0.0, false, 50, 0).run(List.of(strictJob), new ListConversionWarningSink(warnings));

        assertEquals(1, report.getUnsupported().get("cls.py").size());
        assertTrue(hasCode(warnings, WarningCode.UNSUPPORTED_CONSTRUCT, "cls.py"));
        assertTrue(hasCode(warnings, WarningCode.STRICT_MODE_VIOLATION, "cls.py"));
        assertTrue(report.getResults().get(0).getErrorCount() > 0);
    }

    @Test
    void should_turn_writer_failure_into_fail_row() throws Exception {
        List<ConversionJob> jobs = List.of(job("ok.py", "x = 1\n", "python", "javascript"));

        BatchConversionRunner.Report report = new BatchConversionRunner(coordinator,
                (outDir, sourceFile, target, code) -> {
                    throw new IllegalStateException("disk full");
                },
                tempDir, 0.5, false, 50, 0).run(jobs, null);

        assertEquals(FileConversionResult.STATUS_FAIL, report.getResults().get(0).getStatus());
        assertEquals("WRITE_FAILED", report.getResults().get(0).getMessage());
        assertEquals(1, report.getFail());
    }
}
