package domain.convert;

import domain.mapping.MappingDirection;
import domain.mapping.MethodNameMapper;
import domain.model.ConstructKind;
import domain.model.ConversionMetadata;
import domain.model.ConversionResult;
import domain.model.Grammar;
import domain.model.Severity;
import domain.model.SourceLine;
import domain.model.TransformOutcome;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Line-based conversion from one grammar to another.
 *
 * <p>Per line: measure indentation, classify through the {@link RuleRegistry}, apply the first
 * successful rule of the bucket, otherwise fall back to {@link #genericConvert(String)}. A line
 * is never dropped, except closing-brace-only lines when the target has no braces. A block that
 * closes without a body gets {@code pass} in an indentation-delimited target.</p>
 *
 * <p>When the target uses braces and the source does not, closing braces are rebuilt from the
 * open-block stack: one per block whose depth is at or above the next code line's depth,
 * innermost first, indented like the block header. Blank and comment lines do not close
 * blocks.</p>
 *
 * <p>Instances hold no per-call state and may be reused or shared.</p>
 */
public abstract class ConversionPipeline {

    /** Body written under a block header whose source block was empty. */
    private static final String EMPTY_BODY = "pass";

    private final Grammar source;
    private final Grammar target;
    private final RuleRegistry registry;
    private final MethodNameMapper methods;
    private final ConfidenceScorer scorer = new ConfidenceScorer();

    protected ConversionPipeline(Grammar source, Grammar target, RuleRegistry registry, MethodNameMapper methods) {
        this.source = source;
        this.target = target;
        this.registry = registry;
        this.methods = methods;
    }

    public Grammar source() {
        return source;
    }

    public Grammar target() {
        return target;
    }

    public RuleRegistry registry() {
        return registry;
    }

    /** Grammar-agnostic token substitution for lines no rule converted. */
    protected abstract String genericConvert(String content);

    /**
     * Detail text when {@code content} is block structure that no rule can carry over: an
     * unknown block header or a block opened and closed on one line. Null otherwise.
     */
    protected abstract String unrecognizedBlock(String content, ConstructKind kind);

    public final ConversionResult convert(String code) {
        if (code == null || code.isBlank()) {
            return new ConversionResult("", source.id(), target.id(), 1.0, List.of(), List.of(), 1,
                    ConversionMetadata.ofLines(0));
        }

        // 1) fresh per-call state
        BlockState blocks = new BlockState();
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();
        RuleContext ctx = new RuleContext(blocks, diagnostics, methods, MappingDirection.of(source, target));

        String[] rawLines = code.split("\r?\n", -1);
        boolean stripDelimiters = source.usesBraces() && !target.usesBraces();
        boolean rebuildDelimiters = !source.usesBraces() && target.usesBraces();
        int braceUnit = source.usesBraces() ? detectBraceUnit(rawLines) : 0;

        Emitter out = new Emitter(rebuildDelimiters);
        Map<ConstructKind, Integer> counts = new EnumMap<>(ConstructKind.class);
        int level = 1;
        int eligible = 0;
        int converted = 0;
        int emptyBodyDepth = -1;

        for (int i = 0; i < rawLines.length; i++) {
            String raw = rawLines[i];
            int lineNumber = i + 1;

            if (raw.isBlank()) {
                out.pendingBlank();
                continue;
            }

            // 2) indentation depth
            int width = BlockState.leadingWidth(raw);
            int depth = source.usesBraces() ? BlockState.braceDepth(width, braceUnit) : BlockState.indentDepth(width);

            String body = raw.trim();
            if (stripDelimiters) {
                while (body.startsWith("}")) {
                    if (emptyBodyDepth >= 0) {
                        out.line(indent(emptyBodyDepth + 1) + EMPTY_BODY);
                        emptyBodyDepth = -1;
                    }
                    blocks.exitBlock();
                    body = body.substring(1).trim();
                    if (body.startsWith(";")) body = body.substring(1).trim();
                }
                if (body.isEmpty()) continue;
            }

            // 3) classify
            String content;
            String trailingComment = null;
            ConstructKind kind;
            if (registry.matchesKind(ConstructKind.COMMENT, body)) {
                content = body;
                kind = ConstructKind.COMMENT;
            } else {
                String[] parts = CodeScan.splitTrailingComment(body, source.commentPrefix());
                content = parts[0].trim();
                trailingComment = parts[1];
                if (content.isEmpty()) {
                    content = body;
                    trailingComment = null;
                    kind = ConstructKind.COMMENT;
                } else {
                    kind = registry.classify(content);
                }
            }

            ConversionRule first = registry.firstMatch(kind, content);
            boolean opens = source.usesBraces() ? content.endsWith("{") : (first != null && first.opensBlock());
            SourceLine line = new SourceLine(raw, lineNumber, width, depth, kind, content, trailingComment,
                    opens, blocks.currentDepth());
            counts.merge(kind, 1, Integer::sum);
            eligible++;

            // 4) closing delimiters for blocks left by this line
            if (kind == ConstructKind.COMMENT) {
                TransformOutcome comment = apply(line, ctx);
                boolean ok = comment != null && comment.isSuccess();
                if (ok) converted++;
                out.pendingComment(depth, indent(depth) + (ok ? comment.getText() : content));
                continue;
            }
            if (rebuildDelimiters) {
                out.flushWithClosers(depth, blocks.closeTo(depth), this::closingLine);
            } else {
                out.flush();
            }

            // 5) transform
            String unrecognized = unrecognizedBlock(content, kind);
            TransformOutcome outcome = unrecognized == null ? apply(line, ctx) : TransformOutcome.failure(null);
            String text;
            if (outcome.isSuccess()) {
                text = outcome.getText();
                level = Math.max(level, outcome.getLevel());
                if (outcome.getWarning() != null) diagnostics.warn(lineNumber, outcome.getWarning());
                converted++;
            } else {
                if (outcome.getWarning() != null) diagnostics.warn(lineNumber, outcome.getWarning());
                text = genericConvert(content);
                if (unrecognized != null) {
                    diagnostics.unsupported(lineNumber, kind, Severity.ERROR, unrecognized);
                    diagnostics.warn(lineNumber, unrecognized + ", kept as is: " + content);
                } else if (kind == ConstructKind.STATEMENT) {
                    converted++;
                }
            }

            // 6) block state
            if (source.usesBraces()) {
                if (opens) blocks.enterBlock(depth);
            } else if (opens && outcome.isSuccess()) {
                blocks.enterBlock(depth);
            }

            out.line(indent(depth) + withTrailingComment(text, trailingComment));
            emptyBodyDepth = stripDelimiters && opens && (first == null || first.opensBlock()) ? depth : -1;
        }

        if (emptyBodyDepth >= 0) out.line(indent(emptyBodyDepth + 1) + EMPTY_BODY);

        if (rebuildDelimiters) {
            out.flushWithClosers(0, blocks.closeAll(), this::closingLine);
        } else {
            out.flush();
        }

        String convertedCode = String.join("\n", out.lines());
        double confidence = scorer.calculate(code, convertedCode, converted, eligible, diagnostics.unsupportedCount());

        // 7) metadata
        Map<String, String> extras = new LinkedHashMap<>();
        if (source.usesBraces()) extras.put("indentUnit", String.valueOf(braceUnit));
        ConversionMetadata metadata = new ConversionMetadata(rawLines.length, blocks.blockCount(), blocks.maxDepth(),
                counts, extras);

        return new ConversionResult(convertedCode, source.id(), target.id(), confidence,
                diagnostics.warnings(), diagnostics.unsupportedConstructs(), level, metadata);
    }

    /** The first rule of the bucket that matches decides the outcome. */
    private TransformOutcome apply(SourceLine line, RuleContext ctx) {
        for (ConversionRule rule : registry.bucket(line.getKind())) {
            if (!rule.matches(line.getContent())) continue;
            try {
                TransformOutcome outcome = rule.transform(line, ctx);
                return outcome != null ? outcome : TransformOutcome.failure(null);
            } catch (RuntimeException e) {
                ctx.diagnostics().ruleFault(line.getLineNumber(), line.getKind(),
                        e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
                return TransformOutcome.failure(null);
            }
        }
        return TransformOutcome.failure(line.getKind() == ConstructKind.STATEMENT ? null
                : "'" + line.getKind().label() + "' could not be converted, kept with token substitution");
    }

    private String withTrailingComment(String text, String trailingComment) {
        if (trailingComment == null) return text;
        String comment = target.commentPrefix() + trailingComment;
        return text.isEmpty() ? comment : text + "  " + comment;
    }

    private String closingLine(int blockDepth) {
        return indent(blockDepth) + "}";
    }

    private String indent(int depth) {
        return target.indent(depth);
    }

    private static int detectBraceUnit(String[] rawLines) {
        List<Integer> widths = new ArrayList<>(rawLines.length);
        for (String raw : rawLines) {
            if (!raw.isBlank()) widths.add(BlockState.leadingWidth(raw));
        }
        return BlockState.detectBraceUnit(widths);
    }

    protected static String firstWord(String content) {
        int sp = 0;
        while (sp < content.length() && (Character.isLetterOrDigit(content.charAt(sp)) || content.charAt(sp) == '_')) {
            sp++;
        }
        return sp == 0 ? content : content.substring(0, sp);
    }

    /**
     * Output buffer that holds blank and comment lines until the next code line, so rebuilt
     * closing braces can be placed after comments that still belong to the closed blocks.
     */
    private static final class Emitter {

        private static final int BLANK = -1;

        private final boolean holdPending;
        private final List<String> lines = new ArrayList<>();
        private final List<String> pending = new ArrayList<>();
        private final List<Integer> pendingDepths = new ArrayList<>();

        Emitter(boolean holdPending) {
            this.holdPending = holdPending;
        }

        void pendingBlank() {
            pending.add("");
            pendingDepths.add(BLANK);
            if (!holdPending) flush();
        }

        void pendingComment(int depth, String text) {
            pending.add(text);
            pendingDepths.add(depth);
            if (!holdPending) flush();
        }

        void line(String text) {
            lines.add(text);
        }

        void flush() {
            lines.addAll(pending);
            pending.clear();
            pendingDepths.clear();
        }

        void flushWithClosers(int nextDepth, List<Integer> closedDepths,
                              java.util.function.IntFunction<String> closer) {
            if (closedDepths.isEmpty()) {
                flush();
                return;
            }
            int split = 0;
            for (int i = 0; i < pendingDepths.size(); i++) {
                if (pendingDepths.get(i) > nextDepth) split = i + 1;
            }
            lines.addAll(pending.subList(0, split));
            for (int d : closedDepths) {
                lines.add(closer.apply(d));
            }
            lines.addAll(pending.subList(split, pending.size()));
            pending.clear();
            pendingDepths.clear();
        }

        List<String> lines() {
            return lines;
        }
    }
}
