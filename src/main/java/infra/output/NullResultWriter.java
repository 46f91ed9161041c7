package infra.output;

import domain.model.ConversionWarning;
import domain.model.FileConversionResult;
import domain.model.UnsupportedConstruct;
import domain.output.ResultWriter;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * No-op implementation (no --result given).
 */
public final class NullResultWriter implements ResultWriter {
    @Override
    public void write(
            Path resultXlsx,
            List<FileConversionResult> results,
            List<ConversionWarning> warnings,
            Map<String, List<UnsupportedConstruct>> unsupported
    ) {
        // intentionally no-op
    }
}
