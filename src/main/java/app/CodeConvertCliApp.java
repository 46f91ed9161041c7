package app;

import cli.CliArgParser;
import cli.CliMode;
import cli.CliPathResolver;
import cli.CliProgressMonitor;
import cli.CodeConvertCli;
import domain.convert.ConversionCoordinator;
import domain.mapping.MethodNameMapper;
import domain.model.ConversionJob;
import domain.model.ConversionResult;
import domain.model.ConversionWarning;
import domain.model.DetectAndConvertResult;
import domain.model.DetectionResult;
import domain.model.Grammar;
import domain.model.LanguageScore;
import domain.model.ListConversionWarningSink;
import domain.model.UnsupportedConstruct;
import domain.output.ConvertedCodeWriter;
import domain.output.ResultWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** CLI entry (invoked by {@link CodeConvertCli}). Returns the process exit code. */
public final class CodeConvertCliApp {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private CodeConvertCliApp() {}

    public static int run(String[] args) {
        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        // ------------------------------------------------------------
        // baseDir / mode / method mapping
        // ------------------------------------------------------------
        CliPathResolver.applyBaseDirPropertyIfPresent(argv);
        Path baseDir = CliPathResolver.resolveBaseDir();
        CliMode mode = CliArgParser.parseMode(argv.get("mode"));

        CodeConvertComponentsFactory factory = new CodeConvertComponentsFactory();
        try {
            Path mappingPath = CliPathResolver.resolvePath(baseDir, argv.get("mapping"));

            System.out.println("==================================================");
            System.out.println("[START] Code conversion");
            System.out.println("[CONF] baseDir        = " + baseDir);
            System.out.println("[CONF] mode           = " + mode);
            System.out.println("[CONF] mapping        = " + (mappingPath == null ? "(built-in)" : mappingPath));

            if (mappingPath != null) CliPathResolver.validateFileExists(mappingPath, "method mapping (--mapping)");
            MethodNameMapper mapper = factory.createMethodMapper(mappingPath);
            System.out.println("[INIT] method mappings = " + mapper.size());
            ConversionCoordinator coordinator = factory.createCoordinator(mapper);

            int code;
            switch (mode) {
                case DETECT:
                    code = runDetect(argv, baseDir, coordinator);
                    break;
                case BATCH:
                    code = runBatch(argv, baseDir, coordinator, factory);
                    break;
                default:
                    code = runConvert(argv, baseDir, coordinator, factory);
            }

            long ms = (System.nanoTime() - t0) / 1_000_000L;
            System.out.println("[DONE] elapsedMs=" + ms);
            return code;
        } catch (IllegalArgumentException e) {
            // includes ConversionInputException / UnsupportedPairException
            System.err.println("[ERROR] " + e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalStateException e) {
            System.err.println("[ERROR] " + e.getMessage());
            if (e.getCause() != null) System.err.println("        cause=" + e.getCause());
            return EXIT_FAILURE;
        }
    }

    private static int runConvert(Map<String, String> argv, Path baseDir, ConversionCoordinator coordinator,
                                  CodeConvertComponentsFactory factory) {
        Path in = CliPathResolver.resolvePath(baseDir, require(argv, "in"));
        String to = require(argv, "to");
        String from = CliPathResolver.trimToNull(argv.get("from"));
        boolean strict = CliArgParser.flag(argv, "strict");
        Path out = CliPathResolver.resolvePath(baseDir, argv.get("out"));

        System.out.println("[CONF] in             = " + in);
        System.out.println("[CONF] from           = " + (from == null ? "(detect)" : from));
        System.out.println("[CONF] to             = " + to);
        System.out.println("[CONF] strict         = " + strict);
        System.out.println("[CONF] out            = " + (out == null ? "(stdout)" : out));
        System.out.println("==================================================");

        CliPathResolver.validateFileExists(in, "source file (--in)");
        String code = readSource(in);

        ConversionResult result;
        if (from == null) {
            System.out.println("[STEP] detect source language");
            DetectAndConvertResult dc = coordinator.detectAndConvert(code, to, strict);
            printDetection(dc.getDetection());
            if (dc.getDetection().isUnknown()) {
                System.out.println("[WARN] " + dc.getConversion().getWarnings().get(0));
                return EXIT_FAILURE;
            }
            result = dc.getConversion();
        } else {
            result = coordinator.convert(code, from, to, strict);
        }

        if (out == null) {
            System.out.println("[STEP] converted code");
            System.out.println(result.getConvertedCode());
        } else {
            Path written = writeConverted(out, in, result, factory);
            System.out.println("[STEP] written: " + written);
        }

        System.out.printf(Locale.ROOT, "[STAT] %s->%s confidence=%.2f level=%d warnings=%d unsupported=%d errors=%d%n",
                result.getSourceLanguage(), result.getTargetLanguage(), result.getConfidence(), result.getLevel(),
                result.getWarnings().size(), result.getUnsupportedConstructs().size(), result.getErrorCount());
        for (String w : result.getWarnings()) {
            System.out.println("[WARN] " + w);
        }
        for (UnsupportedConstruct u : result.getUnsupportedConstructs()) {
            System.out.println("[WARN] line " + u.getLine() + " " + u.getSeverity() + " " + u.getKind().label()
                    + ": " + u.getDetail());
        }
        return result.getMetadata().getExtras().containsKey("error") ? EXIT_FAILURE : EXIT_OK;
    }

    private static int runDetect(Map<String, String> argv, Path baseDir, ConversionCoordinator coordinator) {
        Path in = CliPathResolver.resolvePath(baseDir, require(argv, "in"));
        System.out.println("[CONF] in             = " + in);
        System.out.println("==================================================");

        CliPathResolver.validateFileExists(in, "source file (--in)");
        DetectionResult detection = coordinator.detect(readSource(in));
        printDetection(detection);
        return detection.isUnknown() ? EXIT_FAILURE : EXIT_OK;
    }

    private static int runBatch(Map<String, String> argv, Path baseDir, ConversionCoordinator coordinator,
                                CodeConvertComponentsFactory factory) {
        Path manifest = CliPathResolver.resolvePath(baseDir, require(argv, "manifest"));
        String defaultTarget = CliPathResolver.trimToNull(argv.get("to"));
        Path outDir = CliPathResolver.resolvePath(baseDir, argv.get("out"));
        Path resultXlsx = CliPathResolver.resolvePath(baseDir, argv.get("result"));
        boolean strict = CliArgParser.flag(argv, "strict");
        double minConfidence = CliArgParser.parseDouble(argv.get("minConfidence"), 0.5);
        int progressEvery = CliArgParser.parseInt(argv.get("progressEvery"), 50);
        int heartbeatSec = CliArgParser.parseInt(argv.get("heartbeatSec"), 0);
        long slowMs = CliArgParser.parseLong(argv.get("slowMs"), 500L);

        System.out.println("[CONF] manifest       = " + manifest);
        System.out.println("[CONF] to (default)   = " + (defaultTarget == null ? "" : defaultTarget));
        System.out.println("[CONF] out            = " + (outDir == null ? "(disabled)" : outDir));
        System.out.println("[CONF] result         = " + (resultXlsx == null ? "(disabled)" : resultXlsx));
        System.out.println("[CONF] strict         = " + strict);
        System.out.println("[CONF] minConfidence  = " + minConfidence);
        System.out.println("[CONF] progressEvery  = " + progressEvery);
        System.out.println("[CONF] heartbeatSec   = " + heartbeatSec);
        System.out.println("[CONF] slowMs         = " + slowMs);
        System.out.println("==================================================");

        CliPathResolver.validateFileExists(manifest, "manifest csv (--manifest)");
        if (outDir != null) CliPathResolver.mkdirs(outDir);

        List<ConversionJob> jobs = factory.loadJobs(manifest, defaultTarget);
        ConvertedCodeWriter codeWriter = factory.createCodeWriter(outDir != null);
        ResultWriter resultWriter = factory.createResultWriter(resultXlsx != null);

        List<ConversionWarning> warnings = new ArrayList<>(128);
        ListConversionWarningSink sink = new ListConversionWarningSink(warnings);

        System.out.println("[STEP] convert " + jobs.size() + " files");
        Thread heartbeat = CliProgressMonitor.startHeartbeat(jobs.size(), heartbeatSec);
        BatchConversionRunner.Report report;
        try {
            report = new BatchConversionRunner(coordinator, codeWriter, outDir, minConfidence, strict,
                    progressEvery, slowMs).run(jobs, sink);
        } finally {
            if (heartbeat != null) heartbeat.interrupt();
        }

        System.out.println("[STEP] write result");
        resultWriter.write(resultXlsx, report.getResults(), warnings, report.getUnsupported());

        System.out.println("[STAT] total=" + jobs.size()
                + " ok=" + report.getOk()
                + " low=" + report.getLowConfidence()
                + " skip=" + report.getSkip()
                + " fail=" + report.getFail()
                + " warnings=" + warnings.size());
        return report.getFail() > 0 ? EXIT_FAILURE : EXIT_OK;
    }

    private static void printDetection(DetectionResult d) {
        System.out.printf(Locale.ROOT, "[STAT] language=%s confidence=%.2f%n", d.getLanguage(), d.getConfidence());
        System.out.println("[STAT] reason=" + d.getReason());
        for (LanguageScore s : d.getAlternatives()) {
            System.out.printf(Locale.ROOT, "[STAT] alternative %s=%.2f%n", s.getLanguage(), s.getConfidence());
        }
    }

    /** Writes one file or, for a directory target, a file named after the source. */
    private static Path writeConverted(Path out, Path in, ConversionResult result,
                                       CodeConvertComponentsFactory factory) {
        if (CliPathResolver.isFileTarget(out)) {
            try {
                if (out.getParent() != null) Files.createDirectories(out.getParent());
                String code = result.getConvertedCode();
                Files.writeString(out, code.endsWith("\n") ? code : code + "\n", StandardCharsets.UTF_8);
                return out;
            } catch (IOException e) {
                throw new IllegalStateException("Failed to write converted code: " + out, e);
            }
        }
        CliPathResolver.mkdirs(out);
        String sourceFile = in.getFileName() == null ? "converted" : in.getFileName().toString();
        return factory.createCodeWriter(true)
                .write(out, sourceFile, Grammar.fromId(result.getTargetLanguage()), result.getConvertedCode());
    }

    private static String readSource(Path in) {
        try {
            return Files.readString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read source: " + in, e);
        }
    }

    private static String require(Map<String, String> argv, String key) {
        String v = CliPathResolver.trimToNull(argv.get(key));
        if (v == null) throw new IllegalArgumentException("--" + key + " is required");
        return v;
    }
}
