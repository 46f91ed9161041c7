package infra.output;

import domain.model.Grammar;
import domain.output.ConvertedCodeWriter;
import domain.output.OutputFileNamePolicy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link ConvertedCodeWriter} that stores converted code into files.
 * <p>
 * Output layout:
 * {@code <outDir>/<source relative dir>/<source base name><target extension>}
 */
public final class FileConvertedCodeWriter implements ConvertedCodeWriter {

    private static String safeDir(String raw) {
        String s = raw == null ? "" : raw.trim();
        // characters Windows rejects in folder names
        s = s.replaceAll("[\\\\:*?\"<>|]", "_");
        s = s.replaceAll("\\s+", "_");
        return s;
    }

    @Override
    public Path write(Path outDir, String sourceFile, Grammar target, String code) {
        if (outDir == null) throw new IllegalArgumentException("outDir is null");

        Path targetDir = outDir;
        String rel = safeDir(OutputFileNamePolicy.relativeDir(sourceFile));
        if (!rel.isEmpty()) {
            for (String part : rel.split("/")) {
                if (part.isEmpty() || part.equals(".")) continue;
                targetDir = targetDir.resolve(part.startsWith(".") ? "_" + part.substring(1) : part);
            }
        }

        try {
            Files.createDirectories(targetDir);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create output directory: " + targetDir, e);
        }

        Path file = targetDir.resolve(OutputFileNamePolicy.build(sourceFile, target));
        String text = code == null ? "" : code;
        if (!text.isEmpty() && !text.endsWith("\n")) text = text + "\n";
        try {
            Files.writeString(file, text, StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write converted code: " + file, e);
        }
        return file;
    }
}
