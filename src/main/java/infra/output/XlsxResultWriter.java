package infra.output;

import java.nio.file.Path;

import java.util.List;

import java.util.Map;

import domain.model.ConversionWarning;

import domain.model.FileConversionResult;

import domain.model.UnsupportedConstruct;

import domain.output.ResultWriter;

/** {@link ResultWriter} backed by {@link ConversionResultXlsxWriter}. */
public final class XlsxResultWriter implements ResultWriter {

    private final ConversionResultXlsxWriter delegate;

    public XlsxResultWriter(ConversionResultXlsxWriter delegate) {
        this.delegate = delegate == null ? new ConversionResultXlsxWriter() : delegate;
    }

    @Override
    public void write(
            Path resultXlsx,
            List<FileConversionResult> results,
            List<ConversionWarning> warnings,
            Map<String, List<UnsupportedConstruct>> unsupported
    ) {
        delegate.write(resultXlsx, results, warnings, unsupported);
    }
}
