package domain.convert;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockStateTest {

    @Test
    void should_close_blocks_at_or_above_depth_innermost_first() {
        BlockState s = new BlockState();
        s.enterBlock(0);
        s.enterBlock(1);
        s.enterBlock(2);

        assertEquals(List.of(2, 1), s.closeTo(1));
        assertEquals(1, s.currentDepth());
        assertEquals(3, s.maxDepth());
        assertEquals(3, s.blockCount());
    }

    @Test
    void should_not_go_negative_when_exiting_empty_stack() {
        BlockState s = new BlockState();
        assertEquals(-1, s.exitBlock());
        assertTrue(s.closeAll().isEmpty());
        assertEquals(0, s.currentDepth());
    }

    @Test
    void should_report_first_declaration_only_once() {
        BlockState s = new BlockState();
        assertTrue(s.declare("count"));
        assertFalse(s.declare("count"));
        assertTrue(s.isDeclared("count"));
    }

    @Test
    void should_map_small_indents_to_depth_one() {
        assertEquals(0, BlockState.indentDepth(0));
        assertEquals(1, BlockState.indentDepth(2));
        assertEquals(1, BlockState.indentDepth(4));
        assertEquals(2, BlockState.indentDepth(9));
    }

    @Test
    void should_count_tab_as_four_columns() {
        assertEquals(4, BlockState.leadingWidth("\tx"));
        assertEquals(6, BlockState.leadingWidth("  \tx"));
        assertEquals(0, BlockState.leadingWidth("x"));
    }

    @Test
    void should_detect_brace_unit_from_widths() {
        assertEquals(4, BlockState.detectBraceUnit(List.of(0, 4, 8)));
        assertEquals(2, BlockState.detectBraceUnit(List.of(0, 2, 4)));
        assertEquals(2, BlockState.detectBraceUnit(List.of(0, 0)));
        assertEquals(3, BlockState.braceDepth(6, 2));
    }
}
