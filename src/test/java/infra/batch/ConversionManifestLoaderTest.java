package infra.batch;

import domain.model.ConversionJob;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversionManifestLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void should_resolve_paths_against_manifest_directory() throws Exception {
        Path manifest = tempDir.resolve("jobs/manifest.csv");
        Files.createDirectories(manifest.getParent());
        Files.writeString(manifest, "\uFEFFsource_file,from,to,strict\n"
                + "src/a.py,Python,,\n"
                + "src/b.js,,python,yes\n"
                + ",python,javascript,\n", StandardCharsets.UTF_8);

        List<ConversionJob> jobs = new ConversionManifestLoader().load(manifest, "javascript");

        assertEquals(2, jobs.size());

        ConversionJob a = jobs.get(0);
        assertEquals("src/a.py", a.getSourceFile());
        assertEquals(tempDir.resolve("jobs/src/a.py").toAbsolutePath().normalize(), a.getPath());
        assertEquals("python", a.getSourceLanguage());
        assertEquals("javascript", a.getTargetLanguage());
        assertFalse(a.needsDetection());
        assertFalse(a.isStrict(false));
        assertTrue(a.isStrict(true));

        ConversionJob b = jobs.get(1);
        assertTrue(b.needsDetection());
        assertEquals("python", b.getTargetLanguage());
        assertTrue(b.isStrict(false));
    }

    @Test
    void should_require_file_column() throws Exception {
        Path manifest = tempDir.resolve("manifest.csv");
        Files.writeString(manifest, "from,to\npython,javascript\n", StandardCharsets.UTF_8);

        assertThrows(IllegalArgumentException.class,
                () -> new ConversionManifestLoader().load(manifest, "javascript"));
    }

    @Test
    void should_keep_absolute_paths() throws Exception {
        Path source = tempDir.resolve("abs.py").toAbsolutePath();
        Path manifest = tempDir.resolve("manifest.csv");
        Files.writeString(manifest, "file\n\"" + source + "\"\n", StandardCharsets.UTF_8);

        List<ConversionJob> jobs = new ConversionManifestLoader().load(manifest, null);

        assertEquals(source.normalize(), jobs.get(0).getPath());
        assertEquals("", jobs.get(0).getTargetLanguage());
    }
}
