package domain.mapping;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MethodNameMapperTest {

    private final MethodNameMapper mapper = MethodNameMapper.builtIn();

    @Test
    void should_rename_member_calls_in_both_directions() {
        assertEquals("name.toUpperCase()",
                mapper.convert("name.upper()", MappingDirection.PYTHON_TO_JAVASCRIPT).getText());
        assertEquals("items.append(x)",
                mapper.convert("items.push(x)", MappingDirection.JAVASCRIPT_TO_PYTHON).getText());
    }

    @Test
    void should_apply_custom_rewrites() {
        assertEquals("items.length",
                mapper.convert("len(items)", MappingDirection.PYTHON_TO_JAVASCRIPT).getText());
        assertEquals("len(items)",
                mapper.convert("items.length", MappingDirection.JAVASCRIPT_TO_PYTHON).getText());
        assertEquals("parts.join(\", \")",
                mapper.convert("\", \".join(parts)", MappingDirection.PYTHON_TO_JAVASCRIPT).getText());
        assertEquals("Object.keys(d)",
                mapper.convert("d.keys()", MappingDirection.PYTHON_TO_JAVASCRIPT).getText());
    }

    @Test
    void should_rename_free_functions_but_not_members_with_same_name() {
        assertEquals("String(x) + obj.str(y)",
                mapper.convert("str(x) + obj.str(y)", MappingDirection.PYTHON_TO_JAVASCRIPT).getText());
        assertEquals("Math.abs(n)",
                mapper.convert("abs(n)", MappingDirection.PYTHON_TO_JAVASCRIPT).getText());
    }

    @Test
    void should_report_gap_and_leave_text_unchanged_for_unsupported_method() {
        MethodRenameResult r = mapper.convert("n = s.count(\"a\")", MappingDirection.PYTHON_TO_JAVASCRIPT);

        assertEquals("n = s.count(\"a\")", r.getText());
        assertFalse(r.isChanged());
        assertEquals(1, r.getGaps().size());
        assertEquals("count", r.getGaps().get(0).pythonName);
    }

    @Test
    void should_let_extra_rows_take_precedence() {
        MethodMapping extra = MethodMapping.renamed("upper", "toLocaleUpperCase", MethodCategory.TEXT);
        MethodNameMapper m = MethodNameMapper.withExtras(List.of(extra));

        assertEquals(mapper.size() + 1, m.size());
        assertSame(extra, m.lookup("upper", MappingDirection.PYTHON_TO_JAVASCRIPT));
        assertEquals("s.toLocaleUpperCase()",
                m.convert("s.upper()", MappingDirection.PYTHON_TO_JAVASCRIPT).getText());
    }

    @Test
    void should_return_null_for_unknown_lookup() {
        assertNull(mapper.lookup("frobnicate", MappingDirection.PYTHON_TO_JAVASCRIPT));
        assertNull(mapper.lookup(null, MappingDirection.PYTHON_TO_JAVASCRIPT));
    }
}
