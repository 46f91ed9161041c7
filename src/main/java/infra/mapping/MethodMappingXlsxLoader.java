package infra.mapping;

import domain.mapping.MethodMapping;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * XLSX loader for extra method-mapping rows (first sheet, first row is the header).
 * Column names follow {@link MethodMappingCsvLoader}.
 */
public class MethodMappingXlsxLoader {

    private final DataFormatter formatter = new DataFormatter();

    public List<MethodMapping> load(Path xlsxPath) {
        if (xlsxPath == null) throw new IllegalArgumentException("xlsxPath is null");
        if (!Files.exists(xlsxPath)) throw new IllegalArgumentException("mapping xlsx not found: " + xlsxPath);

        try (InputStream is = Files.newInputStream(xlsxPath);
             Workbook wb = new XSSFWorkbook(is)) {

            Sheet sheet = wb.getSheetAt(0);
            Map<String, Integer> idx = new LinkedHashMap<>();
            List<MethodMapping> out = new ArrayList<>(64);
            boolean headerRead = false;

            for (Row row : sheet) {
                if (!headerRead) {
                    for (Cell c : row) {
                        String key = MethodMappingCsvLoader.canonical(formatter.formatCellValue(c));
                        if (key != null) idx.putIfAbsent(key, c.getColumnIndex());
                    }
                    headerRead = true;
                    continue;
                }
                MethodMapping m = MethodMappingRows.toMapping(
                        get(row, idx, "python"),
                        get(row, idx, "javascript"),
                        get(row, idx, "category"),
                        get(row, idx, "direction"),
                        get(row, idx, "note"));
                if (m != null) out.add(m);
            }

            if (!idx.containsKey("python") && !idx.containsKey("javascript")) {
                throw new IllegalArgumentException("mapping xlsx needs a python or javascript column: " + xlsxPath);
            }

            System.out.println("[INIT] extra method mappings (xlsx) = " + out.size());
            return out;

        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load mapping xlsx: " + xlsxPath, e);
        }
    }

    private String get(Row row, Map<String, Integer> idx, String key) {
        Integer i = idx.get(key);
        if (i == null) return "";
        Cell cell = row.getCell(i);
        if (cell == null) return "";
        return formatter.formatCellValue(cell).trim();
    }
}
