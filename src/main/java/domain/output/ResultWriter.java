package domain.output;

import java.nio.file.Path;

import java.util.List;

import java.util.Map;

import domain.model.ConversionWarning;

import domain.model.FileConversionResult;

import domain.model.UnsupportedConstruct;

/** Stores the batch report. */
public interface ResultWriter {

    /**
     * @param unsupported unsupported-construct records per source file, in batch order
     */
    void write(
            Path resultXlsx,
            List<FileConversionResult> results,
            List<ConversionWarning> warnings,
            Map<String, List<UnsupportedConstruct>> unsupported
    );
}
