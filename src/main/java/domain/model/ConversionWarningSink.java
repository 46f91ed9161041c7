package domain.model;

/**
 * Sink for batch conversion warnings.
 *
 * <p>The batch runner reports per-file problems here; the CLI decides whether they end up
 * in the XLSX report.</p>
 */
public interface ConversionWarningSink {

    static ConversionWarningSink none() {
        return NullConversionWarningSink.INSTANCE;
    }

    void warn(ConversionWarning warning);
}
