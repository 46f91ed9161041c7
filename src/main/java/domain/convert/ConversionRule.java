package domain.convert;

import domain.model.ConstructKind;
import domain.model.SourceLine;
import domain.model.TransformOutcome;

/**
 * One line-level conversion rule, bound to a single construct kind.
 *
 * <p>Implementations are the constants of a per-pair enum, so the rule set of a pipeline is
 * closed and fixed at compile time.</p>
 */
public interface ConversionRule {

    ConstructKind kind();

    /** Level reached when the transform succeeds (1..3). */
    int level();

    boolean opensBlock();

    /** True when this rule applies to the trimmed line content. */
    boolean matches(String content);

    /**
     * Converts the line content. Returns text without indentation; the pipeline indents it.
     * May throw; the pipeline records the fault and falls back to generic conversion.
     */
    TransformOutcome transform(SourceLine line, RuleContext ctx);
}
