package app;

import cli.CliProgressMonitor;
import domain.convert.ConversionCoordinator;
import domain.convert.ConversionInputException;
import domain.convert.UnsupportedPairException;
import domain.model.ConversionContext;
import domain.model.ConversionJob;
import domain.model.ConversionResult;
import domain.model.ConversionWarning;
import domain.model.ConversionWarningSink;
import domain.model.DetectAndConvertResult;
import domain.model.DetectionResult;
import domain.model.FileConversionResult;
import domain.model.Grammar;
import domain.model.UnsupportedConstruct;
import domain.model.WarningCode;
import domain.output.ConvertedCodeWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs every manifest row through the coordinator. One bad file never stops the batch;
 * it becomes a {@code FAIL} or {@code SKIP} row plus a warning.
 */
public final class BatchConversionRunner {

    private final ConversionCoordinator coordinator;
    private final ConvertedCodeWriter codeWriter;
    private final Path outDir;
    private final double minConfidence;
    private final boolean defaultStrict;
    private final int progressEvery;
    private final long slowMs;

    public BatchConversionRunner(ConversionCoordinator coordinator, ConvertedCodeWriter codeWriter, Path outDir,
                                 double minConfidence, boolean defaultStrict, int progressEvery, long slowMs) {
        this.coordinator = coordinator;
        this.codeWriter = codeWriter;
        this.outDir = outDir;
        this.minConfidence = minConfidence;
        this.defaultStrict = defaultStrict;
        this.progressEvery = Math.max(1, progressEvery);
        this.slowMs = slowMs;
    }

    /** Rows, unsupported records per file and status counts of one batch. */
    public static final class Report {
        private final List<FileConversionResult> results = new ArrayList<>();
        private final Map<String, List<UnsupportedConstruct>> unsupported = new LinkedHashMap<>();
        private int ok;
        private int lowConfidence;
        private int skip;
        private int fail;

        public List<FileConversionResult> getResults() {
            return Collections.unmodifiableList(results);
        }

        public Map<String, List<UnsupportedConstruct>> getUnsupported() {
            return Collections.unmodifiableMap(unsupported);
        }

        public int getOk() {
            return ok;
        }

        public int getLowConfidence() {
            return lowConfidence;
        }

        public int getSkip() {
            return skip;
        }

        public int getFail() {
            return fail;
        }

        private void add(FileConversionResult r) {
            results.add(r);
            switch (r.getStatus()) {
                case FileConversionResult.STATUS_OK:
                    ok++;
                    break;
                case FileConversionResult.STATUS_LOW_CONFIDENCE:
                    lowConfidence++;
                    break;
                case FileConversionResult.STATUS_SKIP:
                    skip++;
                    break;
                default:
                    fail++;
            }
        }
    }

    public Report run(List<ConversionJob> jobs, ConversionWarningSink warningSink) {
        ConversionWarningSink sink = warningSink == null ? ConversionWarningSink.none() : warningSink;
        Report report = new Report();
        int total = jobs.size();
        long tLoop0 = System.nanoTime();

        for (int i = 0; i < total; i++) {
            ConversionJob job = jobs.get(i);
            CliProgressMonitor.setCurrent(job.getSourceFile(), i + 1);

            long one0 = System.nanoTime();
            report.add(runOne(job, sink, report));

            long oneMs = (System.nanoTime() - one0) / 1_000_000L;
            if (slowMs > 0 && oneMs >= slowMs) {
                System.out.println("[SLOW] " + oneMs + "ms : " + job.getSourceFile());
                sink.warn(new ConversionWarning(WarningCode.SLOW_CONVERSION, job.getSourceFile(),
                        job.getSourceLanguage(), job.getTargetLanguage(),
                        "slowMs=" + slowMs + ", actualMs=" + oneMs, ""));
            }

            if ((i + 1) % progressEvery == 0 || (i + 1) == total) {
                CliProgressMonitor.logProgress(i + 1, total, report.ok, report.lowConfidence, report.skip,
                        report.fail, tLoop0, job.getSourceFile());
            }
        }
        return report;
    }

    private FileConversionResult runOne(ConversionJob job, ConversionWarningSink sink, Report report) {
        String file = job.getSourceFile();
        String target = job.getTargetLanguage();
        ConversionContext ctx = new ConversionContext(file, job.getSourceLanguage(), target);

        String code;
        try {
            if (job.getPath() == null || !Files.isRegularFile(job.getPath())) {
                sink.warn(ConversionWarning.of(WarningCode.SOURCE_READ_FAILED, ctx, "source file not found",
                        String.valueOf(job.getPath())));
                return new FileConversionResult(FileConversionResult.STATUS_FAIL, file, job.getSourceLanguage(),
                        target, "SOURCE_NOT_FOUND");
            }
            code = Files.readString(job.getPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            sink.warn(ConversionWarning.of(WarningCode.SOURCE_READ_FAILED, ctx, e.getClass().getSimpleName(),
                    safe(e.getMessage())));
            return new FileConversionResult(FileConversionResult.STATUS_FAIL, file, job.getSourceLanguage(),
                    target, "SOURCE_READ_FAILED");
        }

        if (code.isBlank()) {
            sink.warn(ConversionWarning.of(WarningCode.SOURCE_EMPTY, ctx, "source file is empty"));
            return new FileConversionResult(FileConversionResult.STATUS_SKIP, file, job.getSourceLanguage(),
                    target, "SOURCE_EMPTY");
        }

        boolean strict = job.isStrict(defaultStrict);
        boolean detected = job.needsDetection();
        ConversionResult result;
        try {
            if (detected) {
                DetectAndConvertResult dc = coordinator.detectAndConvert(code, target, strict);
                DetectionResult detection = dc.getDetection();
                if (detection.isUnknown()) {
                    sink.warn(ConversionWarning.of(WarningCode.LANGUAGE_NOT_DETECTED, ctx,
                            "source language not detected", detection.getReason()));
                    return new FileConversionResult(FileConversionResult.STATUS_SKIP, file, DetectionResult.UNKNOWN,
                            target, "LANGUAGE_NOT_DETECTED");
                }
                ctx = ctx.withSourceLanguage(detection.getLanguage());
                result = dc.getConversion();
            } else {
                result = coordinator.convert(code, job.getSourceLanguage(), target, strict);
            }
        } catch (UnsupportedPairException e) {
            sink.warn(ConversionWarning.of(WarningCode.UNSUPPORTED_PAIR, ctx, "language pair not supported",
                    e.getMessage()));
            return new FileConversionResult(FileConversionResult.STATUS_FAIL, file, ctx.getSourceLanguage(), target,
                    detected, 0.0, 0, 0, 0, 0, null, "UNSUPPORTED_PAIR");
        } catch (ConversionInputException e) {
            sink.warn(ConversionWarning.of(WarningCode.TRANSFORM_ERROR, ctx, "invalid conversion input",
                    e.getMessage()));
            return new FileConversionResult(FileConversionResult.STATUS_FAIL, file, ctx.getSourceLanguage(), target,
                    detected, 0.0, 0, 0, 0, 0, null, "INVALID_INPUT");
        }

        for (String w : result.getWarnings()) {
            sink.warn(ConversionWarning.of(WarningCode.CONVERSION_NOTE, ctx, w));
        }
        if (!result.getUnsupportedConstructs().isEmpty()) {
            report.unsupported.put(file, result.getUnsupportedConstructs());
            sink.warn(ConversionWarning.of(WarningCode.UNSUPPORTED_CONSTRUCT, ctx,
                    result.getUnsupportedConstructs().size() + " unsupported constructs",
                    "errors=" + result.getErrorCount()));
        }
        if (strict && result.getErrorCount() > 0) {
            sink.warn(ConversionWarning.of(WarningCode.STRICT_MODE_VIOLATION, ctx,
                    "strict mode: " + result.getErrorCount() + " error-severity constructs"));
        }

        String error = result.getMetadata().getExtras().get("error");
        if (error != null) {
            System.out.println("[ERROR] conversion failed: " + file);
            System.out.println("        ex=" + error);
            sink.warn(ConversionWarning.of(WarningCode.TRANSFORM_ERROR, ctx, "conversion failed", error));
            return row(FileConversionResult.STATUS_FAIL, file, detected, result, null, "TRANSFORM_ERROR");
        }

        Path written;
        try {
            written = codeWriter.write(outDir, file, Grammar.fromId(result.getTargetLanguage()),
                    result.getConvertedCode());
        } catch (RuntimeException e) {
            System.out.println("[ERROR] write failed: " + file);
            System.out.println("        ex=" + e.getClass().getName() + ": " + safe(e.getMessage()));
            sink.warn(ConversionWarning.of(WarningCode.TRANSFORM_ERROR, ctx, e.getClass().getSimpleName(),
                    safe(e.getMessage())));
            return row(FileConversionResult.STATUS_FAIL, file, detected, result, null, "WRITE_FAILED");
        }

        if (result.getConfidence() < minConfidence) {
            sink.warn(ConversionWarning.of(WarningCode.LOW_CONFIDENCE, ctx,
                    String.format(Locale.ROOT, "confidence %.2f below %.2f", result.getConfidence(), minConfidence)));
            return row(FileConversionResult.STATUS_LOW_CONFIDENCE, file, detected, result, written, "");
        }
        return row(FileConversionResult.STATUS_OK, file, detected, result, written, "");
    }

    private static FileConversionResult row(String status, String file, boolean detected, ConversionResult r,
                                            Path written, String message) {
        return new FileConversionResult(status, file, r.getSourceLanguage(), r.getTargetLanguage(), detected,
                r.getConfidence(), r.getLevel(), r.getWarnings().size(), r.getUnsupportedConstructs().size(),
                r.getErrorCount(), written == null ? "" : written.toString(), message);
    }

    private static String safe(String s) {
        return (s == null) ? "" : s;
    }
}
