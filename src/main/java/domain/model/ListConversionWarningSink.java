package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>Deduplicated by (code|file|source|target|message|detail) so the same diagnostic
 * reported twice for one file yields a single row.</p>
 */
public final class ListConversionWarningSink implements ConversionWarningSink {

    private final List<ConversionWarning> target;
    private final Set<String> seen = new HashSet<>(256);

    public ListConversionWarningSink(List<ConversionWarning> target) {
        this.target = target;
    }

    private static String key(ConversionWarning w) {
        return w.getCode().name() + "|"
                + w.getSourceFile() + "|"
                + w.getSourceLanguage() + "|"
                + w.getTargetLanguage() + "|"
                + w.getMessage() + "|"
                + w.getDetail();
    }

    @Override
    public void warn(ConversionWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
        }
    }
}
