package infra.output;

import domain.model.ConversionWarning;
import domain.model.FileConversionResult;
import domain.model.UnsupportedConstruct;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * XLSX batch report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>result: one row per source file (status, languages, confidence, counts)</li>
 *   <li>warnings: batch-level warnings (standard codes)</li>
 *   <li>unsupported: unsupported-construct records per file and line</li>
 * </ul>
 */
public final class ConversionResultXlsxWriter {

    static final String SHEET_RESULT = "result";
    static final String SHEET_WARNINGS = "warnings";
    static final String SHEET_UNSUPPORTED = "unsupported";

    private static void header(Sheet sh, String... names) {
        Row header = sh.createRow(0);
        for (int i = 0; i < names.length; i++) {
            header.createCell(i)
                    .setCellValue(names[i]);
        }
    }

    private static void writeResultSheet(Workbook wb, List<FileConversionResult> results) {
        Sheet sh = wb.createSheet(SHEET_RESULT);
        header(sh, "status", "sourceFile", "sourceLanguage", "targetLanguage", "detected", "confidence",
                "level", "warnings", "unsupported", "errors", "outputFile", "message");

        int r = 1;
        for (FileConversionResult it : results) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(it.getStatus());
            row.createCell(1)
                    .setCellValue(it.getSourceFile());
            row.createCell(2)
                    .setCellValue(it.getSourceLanguage());
            row.createCell(3)
                    .setCellValue(it.getTargetLanguage());
            row.createCell(4)
                    .setCellValue(it.isDetected());
            row.createCell(5)
                    .setCellValue(it.getConfidence());
            row.createCell(6)
                    .setCellValue(it.getLevel());
            row.createCell(7)
                    .setCellValue(it.getWarningCount());
            row.createCell(8)
                    .setCellValue(it.getUnsupportedCount());
            row.createCell(9)
                    .setCellValue(it.getErrorCount());
            row.createCell(10)
                    .setCellValue(it.getOutputFile());
            row.createCell(11)
                    .setCellValue(it.getMessage());
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<ConversionWarning> warnings) {
        Sheet sh = wb.createSheet(SHEET_WARNINGS);
        header(sh, "code", "sourceFile", "sourceLanguage", "targetLanguage", "message", "detail");

        int r = 1;
        for (ConversionWarning w : warnings) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(w.getCode().name());
            row.createCell(1)
                    .setCellValue(w.getSourceFile());
            row.createCell(2)
                    .setCellValue(w.getSourceLanguage());
            row.createCell(3)
                    .setCellValue(w.getTargetLanguage());
            row.createCell(4)
                    .setCellValue(w.getMessage());
            row.createCell(5)
                    .setCellValue(w.getDetail());
        }
    }

    private static void writeUnsupportedSheet(Workbook wb, Map<String, List<UnsupportedConstruct>> unsupported) {
        Sheet sh = wb.createSheet(SHEET_UNSUPPORTED);
        header(sh, "sourceFile", "line", "kind", "severity", "detail");

        int r = 1;
        for (Map.Entry<String, List<UnsupportedConstruct>> e : unsupported.entrySet()) {
            for (UnsupportedConstruct u : e.getValue()) {
                Row row = sh.createRow(r++);
                row.createCell(0)
                        .setCellValue(e.getKey());
                row.createCell(1)
                        .setCellValue(u.getLine());
                row.createCell(2)
                        .setCellValue(u.getKind().label());
                row.createCell(3)
                        .setCellValue(u.getSeverity().name());
                row.createCell(4)
                        .setCellValue(u.getDetail());
            }
        }
    }

    public void write(
            Path resultXlsx,
            List<FileConversionResult> results,
            List<ConversionWarning> warnings,
            Map<String, List<UnsupportedConstruct>> unsupported
    ) {
        if (resultXlsx == null) throw new IllegalArgumentException("resultXlsx is null");
        if (results == null) throw new IllegalArgumentException("results is null");
        if (warnings == null) throw new IllegalArgumentException("warnings is null");
        if (unsupported == null) throw new IllegalArgumentException("unsupported is null");

        try {
            Path parent = resultXlsx.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create resultXlsx parent dir: " + resultXlsx, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeResultSheet(wb, results);
            writeWarningsSheet(wb, warnings);
            writeUnsupportedSheet(wb, unsupported);

            try (OutputStream os = Files.newOutputStream(resultXlsx)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + resultXlsx, e);
        }
    }
}
