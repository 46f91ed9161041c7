package infra.mapping;

import domain.mapping.MethodMapping;
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
 * CSV loader for extra method-mapping rows.
 *
 * <p>Header names are matched loosely (case, spaces, hyphens and a UTF-8 BOM ignored):
 * {@code python|py}, {@code javascript|js}, {@code category|type}, {@code direction|dir},
 * {@code note|comment}.</p>
 */
public final class MethodMappingCsvLoader {

    public List<MethodMapping> load(Path csvPath) {
        if (csvPath == null) throw new IllegalArgumentException("csvPath is null");
        if (!Files.exists(csvPath)) throw new IllegalArgumentException("mapping csv not found: " + csvPath);

        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT
                     .builder()
                     .setTrim(true)
                     .setIgnoreEmptyLines(true)
                     .build()
                     .parse(reader)) {

            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) return Collections.emptyList();

            Map<String, Integer> idx = headerIndex(it.next());
            if (!idx.containsKey("python") && !idx.containsKey("javascript")) {
                throw new IllegalArgumentException("mapping csv needs a python or javascript column: " + csvPath);
            }

            List<MethodMapping> out = new ArrayList<>(64);
            while (it.hasNext()) {
                CSVRecord r = it.next();
                MethodMapping m = MethodMappingRows.toMapping(
                        get(r, idx, "python"),
                        get(r, idx, "javascript"),
                        get(r, idx, "category"),
                        get(r, idx, "direction"),
                        get(r, idx, "note"));
                if (m != null) out.add(m);
            }

            System.out.println("[INIT] extra method mappings (csv) = " + out.size());
            return out;

        } catch (IOException e) {
            throw new IllegalStateException("Failed to load mapping csv: " + csvPath, e);
        }
    }

    private static Map<String, Integer> headerIndex(CSVRecord header) {
        Map<String, Integer> m = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String key = canonical(header.get(i));
            if (key != null) m.putIfAbsent(key, i);
        }
        return m;
    }

    /** Canonical column name for a header cell, or null when the column is not used. */
    static String canonical(String raw) {
        String t = raw == null ? "" : raw;
        if (!t.isEmpty() && t.charAt(0) == '\uFEFF') t = t.substring(1);
        t = t.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", "");
        switch (t) {
            case "python":
            case "py":
            case "pythonname":
                return "python";
            case "javascript":
            case "js":
            case "javascriptname":
                return "javascript";
            case "category":
            case "type":
                return "category";
            case "direction":
            case "dir":
                return "direction";
            case "note":
            case "comment":
            case "notes":
                return "note";
            default:
                return null;
        }
    }

    private static String get(CSVRecord r, Map<String, Integer> idx, String key) {
        Integer i = idx.get(key);
        if (i == null || i >= r.size()) return "";
        return r.get(i);
    }
}
