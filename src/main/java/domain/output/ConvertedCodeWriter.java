package domain.output;

import domain.model.Grammar;

import java.nio.file.Path;

/** Stores converted code as a file. */
public interface ConvertedCodeWriter {

    /**
     * @return the written file, or null when nothing was written
     */
    Path write(Path outDir, String sourceFile, Grammar target, String code);
}
