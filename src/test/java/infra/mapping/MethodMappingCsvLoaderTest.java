package infra.mapping;

import domain.mapping.MappingDirection;
import domain.mapping.MethodCategory;
import domain.mapping.MethodMapping;
import domain.mapping.MethodTarget;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MethodMappingCsvLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void should_load_rows_with_loose_header_names() throws Exception {
        Path csv = tempDir.resolve("methods.csv");
        Files.writeString(csv, "\uFEFFPython Name,JS,Type,Note\n"
                + "upper,toLocaleUpperCase,string,\n"
                + "len,length,builtin,\n", StandardCharsets.UTF_8);

        List<MethodMapping> rows = new MethodMappingCsvLoader().load(csv);

        assertEquals(2, rows.size());
        MethodMapping first = rows.get(0);
        assertEquals("upper", first.pythonName);
        assertEquals("toLocaleUpperCase", first.javascriptName);
        assertEquals(MethodCategory.TEXT, first.category);
        assertEquals(MethodTarget.Kind.RENAME, first.target(MappingDirection.PYTHON_TO_JAVASCRIPT).kind());
        assertEquals("upper", first.target(MappingDirection.JAVASCRIPT_TO_PYTHON).name());
        assertEquals(MethodCategory.FREE_FUNCTION, rows.get(1).category);
    }

    @Test
    void should_mark_single_name_and_one_way_rows_as_gaps() throws Exception {
        Path csv = tempDir.resolve("methods.csv");
        Files.writeString(csv, "python,javascript,direction,note\n"
                + "casefold,,,no locale-free fold\n"
                + "title,toTitle,toJs,\n"
                + ",,,\n", StandardCharsets.UTF_8);

        List<MethodMapping> rows = new MethodMappingCsvLoader().load(csv);

        assertEquals(2, rows.size());
        MethodTarget gap = rows.get(0).target(MappingDirection.PYTHON_TO_JAVASCRIPT);
        assertEquals(MethodTarget.Kind.UNSUPPORTED, gap.kind());
        assertEquals("no locale-free fold", gap.note());
        assertNull(rows.get(0).target(MappingDirection.JAVASCRIPT_TO_PYTHON));

        assertEquals(MethodTarget.Kind.RENAME, rows.get(1).target(MappingDirection.PYTHON_TO_JAVASCRIPT).kind());
        assertEquals(MethodTarget.Kind.UNSUPPORTED, rows.get(1).target(MappingDirection.JAVASCRIPT_TO_PYTHON).kind());
    }

    @Test
    void should_reject_file_without_name_columns() throws Exception {
        Path csv = tempDir.resolve("bad.csv");
        Files.writeString(csv, "foo,bar\n1,2\n", StandardCharsets.UTF_8);

        assertThrows(IllegalArgumentException.class, () -> new MethodMappingCsvLoader().load(csv));
    }

    @Test
    void should_reject_missing_file() {
        assertThrows(IllegalArgumentException.class,
                () -> new MethodMappingCsvLoader().load(tempDir.resolve("none.csv")));
    }

    @Test
    void should_return_empty_list_for_empty_file() throws Exception {
        Path csv = tempDir.resolve("empty.csv");
        Files.writeString(csv, "", StandardCharsets.UTF_8);

        assertTrue(new MethodMappingCsvLoader().load(csv).isEmpty());
    }
}
