package infra.output;

import domain.model.Grammar;
import domain.output.ConvertedCodeWriter;

import java.nio.file.Path;

/**
 * No-op implementation (no --out given).
 */
public final class NullConvertedCodeWriter implements ConvertedCodeWriter {
    @Override
    public Path write(Path outDir, String sourceFile, Grammar target, String code) {
        return null;
    }
}
