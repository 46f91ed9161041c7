package infra.batch;

import domain.model.ConversionJob;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Batch manifest loader.
 *
 * <p>Columns (header names matched loosely, BOM tolerated):
 * <ul>
 *   <li>file / path / source_file: source path, relative to the manifest directory unless absolute</li>
 *   <li>source / from / source_language: optional; blank means detect</li>
 *   <li>target / to / target_language: optional; blank uses the run-wide {@code --to}</li>
 *   <li>strict: optional boolean</li>
 * </ul>
 * Rows without a file are skipped.</p>
 */
public class ConversionManifestLoader {

    public List<ConversionJob> load(Path manifestCsv, String defaultTarget) {
        if (manifestCsv == null) throw new IllegalArgumentException("manifest is null");
        if (!Files.exists(manifestCsv)) throw new IllegalArgumentException("manifest not found: " + manifestCsv);

        Path baseDir = manifestCsv.toAbsolutePath().normalize().getParent();

        try (Reader reader = Files.newBufferedReader(manifestCsv, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT
                     .builder()
                     .setTrim(true)
                     .setIgnoreEmptyLines(true)
                     .build()
                     .parse(reader)) {

            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) return Collections.emptyList();

            CSVRecord headerRec = it.next();
            Map<String, Integer> idx = new LinkedHashMap<>();
            for (int i = 0; i < headerRec.size(); i++) {
                String key = canonical(headerRec.get(i));
                if (key != null) idx.putIfAbsent(key, i);
            }
            if (!idx.containsKey("file")) {
                throw new IllegalArgumentException("manifest has no file column: " + manifestCsv);
            }

            List<ConversionJob> out = new ArrayList<>(256);
            while (it.hasNext()) {
                CSVRecord r = it.next();
                String file = get(r, idx, "file");
                if (file.isBlank()) continue;

                String source = get(r, idx, "source");
                String target = get(r, idx, "target");
                if (target.isBlank()) target = defaultTarget == null ? "" : defaultTarget;
                String strictRaw = get(r, idx, "strict");

                Path p = Path.of(file);
                if (!p.isAbsolute() && baseDir != null) p = baseDir.resolve(p);

                out.add(new ConversionJob(
                        file,
                        p.toAbsolutePath().normalize(),
                        source.isBlank() ? null : source.toLowerCase(Locale.ROOT),
                        target.toLowerCase(Locale.ROOT),
                        strictRaw.isBlank() ? null : parseBoolean(strictRaw)));
            }

            System.out.println("[MANIFEST] loaded=" + out.size());
            return out;

        } catch (IOException e) {
            throw new IllegalStateException("Failed to load manifest: " + manifestCsv, e);
        }
    }

    static String canonical(String raw) {
        String t = raw == null ? "" : raw;
        if (!t.isEmpty() && t.charAt(0) == '\uFEFF') t = t.substring(1);
        t = t.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", "");
        switch (t) {
            case "file":
            case "path":
            case "sourcefile":
                return "file";
            case "source":
            case "from":
            case "sourcelanguage":
                return "source";
            case "target":
            case "to":
            case "targetlanguage":
                return "target";
            case "strict":
            case "strictmode":
                return "strict";
            default:
                return null;
        }
    }

    private static boolean parseBoolean(String s) {
        String v = s.trim().toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    private static String get(CSVRecord r, Map<String, Integer> idx, String key) {
        Integer i = idx.get(key);
        if (i == null || i >= r.size()) return "";
        String v = r.get(i);
        return v == null ? "" : v.trim();
    }
}
