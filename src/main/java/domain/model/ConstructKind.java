package domain.model;

/**
 * Syntactic category assigned to a source line.
 */
public enum ConstructKind {

    COMMENT("comment"),
    OUTPUT_STATEMENT("output"),
    VARIABLE_BINDING("variable"),
    CONDITIONAL_IF("condition_if"),
    CONDITIONAL_ELIF("condition_elif"),
    CONDITIONAL_ELSE("condition_else"),
    LOOP_FOR("loop_for"),
    LOOP_WHILE("loop_while"),
    FUNCTION_DEFINITION("function"),
    EXCEPTION_TRY("try"),
    EXCEPTION_HANDLER("except"),
    METHOD_CALL("method_call"),
    SEQUENCE_TRANSFORM("sequence_transform"),
    /** Unmatched line; converted by token substitution only. */
    STATEMENT("statement");

    private final String label;

    ConstructKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
