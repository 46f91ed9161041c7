package app;

import domain.convert.ConversionCoordinator;
import domain.mapping.MethodMapping;
import domain.mapping.MethodNameMapper;
import domain.model.ConversionJob;
import domain.output.ConvertedCodeWriter;
import domain.output.ResultWriter;
import infra.batch.ConversionManifestLoader;
import infra.mapping.MethodMappingCsvLoader;
import infra.mapping.MethodMappingXlsxLoader;
import infra.output.ConversionResultXlsxWriter;
import infra.output.FileConvertedCodeWriter;
import infra.output.NullConvertedCodeWriter;
import infra.output.NullResultWriter;
import infra.output.XlsxResultWriter;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Object-assembly factory for {@link CodeConvertCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration and logging; object creation lives here.
 */
final class CodeConvertComponentsFactory {

    /** Built-in table, with extra rows from CSV or XLSX placed first when a path is given. */
    MethodNameMapper createMethodMapper(Path mappingPath) {
        if (mappingPath == null) return MethodNameMapper.builtIn();
        String name = mappingPath.getFileName() == null ? "" : mappingPath.getFileName().toString()
                .toLowerCase(Locale.ROOT);
        List<MethodMapping> extras = name.endsWith(".xlsx")
                ? new MethodMappingXlsxLoader().load(mappingPath)
                : new MethodMappingCsvLoader().load(mappingPath);
        return MethodNameMapper.withExtras(extras);
    }

    ConversionCoordinator createCoordinator(MethodNameMapper mapper) {
        return ConversionCoordinator.createDefault(mapper);
    }

    List<ConversionJob> loadJobs(Path manifestCsv, String defaultTarget) {
        return new ConversionManifestLoader().load(manifestCsv, defaultTarget);
    }

    ConvertedCodeWriter createCodeWriter(boolean enable) {
        if (!enable) return new NullConvertedCodeWriter();
        return new FileConvertedCodeWriter();
    }

    ResultWriter createResultWriter(boolean enable) {
        if (!enable) return new NullResultWriter();
        return new XlsxResultWriter(new ConversionResultXlsxWriter());
    }
}
