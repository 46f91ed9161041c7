package domain.convert;

import domain.detect.LanguageIdentifier;
import domain.mapping.MethodNameMapper;
import domain.model.ConversionMetadata;
import domain.model.ConversionResult;
import domain.model.DetectAndConvertResult;
import domain.model.DetectionResult;
import domain.model.Grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entry point for conversions: owns the grammar-pair registry and the language identifier.
 *
 * <p>Client errors (blank code, missing grammar id, unregistered pair) are thrown as
 * {@link ConversionInputException}. Every other failure is turned into a degraded result that
 * carries the original code with confidence 0.</p>
 */
public final class ConversionCoordinator {

    /** Builds a fresh pipeline for one registered pair. */
    @FunctionalInterface
    public interface PipelineFactory {
        ConversionPipeline create(MethodNameMapper methods);
    }

    static final String SAME_LANGUAGE_WARNING = "Source and target languages are the same";
    static final String NOT_DETECTED_WARNING = "Could not detect source language";

    private final Map<String, PipelineFactory> pipelines;
    private final MethodNameMapper methods;
    private final LanguageIdentifier identifier;

    public ConversionCoordinator(Map<String, PipelineFactory> pipelines, MethodNameMapper methods,
                                 LanguageIdentifier identifier) {
        this.pipelines = Collections.unmodifiableMap(new LinkedHashMap<>(pipelines));
        this.methods = methods;
        this.identifier = identifier;
    }

    /** Registry with python->javascript and javascript->python. */
    public static ConversionCoordinator createDefault(MethodNameMapper methods) {
        Map<String, PipelineFactory> m = new LinkedHashMap<>();
        m.put(pairKey(Grammar.PYTHON.id(), Grammar.JAVASCRIPT.id()), PythonToJavaScriptPipeline::new);
        m.put(pairKey(Grammar.JAVASCRIPT.id(), Grammar.PYTHON.id()), JavaScriptToPythonPipeline::new);
        return new ConversionCoordinator(m, methods, new LanguageIdentifier());
    }

    public static String pairKey(String source, String target) {
        return normalize(source) + "->" + normalize(target);
    }

    public List<String> supportedPairs() {
        return new ArrayList<>(pipelines.keySet());
    }

    public boolean supports(String source, String target) {
        return pipelines.containsKey(pairKey(source, target));
    }

    public LanguageIdentifier identifier() {
        return identifier;
    }

    public ConversionResult convert(String code, String source, String target, boolean strict) {
        if (code == null || code.isBlank()) {
            throw new ConversionInputException("No code provided");
        }
        if (source == null || source.isBlank()) {
            throw new ConversionInputException("Source language is required");
        }
        if (target == null || target.isBlank()) {
            throw new ConversionInputException("Target language is required");
        }
        String src = normalize(source);
        String dst = normalize(target);

        if (src.equals(dst)) {
            return new ConversionResult(code, src, dst, 1.0, List.of(SAME_LANGUAGE_WARNING), List.of(), 1,
                    ConversionMetadata.ofLines(code.split("\r?\n", -1).length));
        }

        PipelineFactory factory = pipelines.get(pairKey(src, dst));
        if (factory == null) {
            throw new UnsupportedPairException(src, dst, supportedPairs());
        }

        ConversionResult result;
        try {
            result = factory.create(methods).convert(code);
        } catch (RuntimeException e) {
            return degraded(code, src, dst, e);
        }

        if (strict && result.getErrorCount() > 0) {
            result = result.withLeadingWarning("STRICT MODE: found " + result.getErrorCount()
                    + " unsupported constructs; conversion was not aborted, review unsupported constructs");
        }
        return result;
    }

    public DetectionResult detect(String code) {
        return identifier.detect(code);
    }

    public DetectAndConvertResult detectAndConvert(String code, String target, boolean strict) {
        DetectionResult detection = identifier.detect(code);
        if (detection.isUnknown()) {
            ConversionResult none = new ConversionResult("", DetectionResult.UNKNOWN, normalize(target), 0.0,
                    List.of(NOT_DETECTED_WARNING), List.of(), 0, ConversionMetadata.empty());
            return new DetectAndConvertResult(detection, none);
        }
        return new DetectAndConvertResult(detection, convert(code, detection.getLanguage(), target, strict));
    }

    private static ConversionResult degraded(String code, String src, String dst, RuntimeException e) {
        String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        ConversionMetadata metadata = ConversionMetadata.ofLines(code.split("\r?\n", -1).length)
                .withExtra("error", msg);
        return new ConversionResult(code, src, dst, 0.0,
                List.of("Conversion error: " + msg, "Returned original code"), List.of(), 0, metadata);
    }

    private static String normalize(String id) {
        return id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
    }
}
