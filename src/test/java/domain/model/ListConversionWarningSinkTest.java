package domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListConversionWarningSinkTest {

    @Test
    void should_deduplicate_identical_warnings() {
        List<ConversionWarning> out = new ArrayList<>();
        ListConversionWarningSink sink = new ListConversionWarningSink(out);
        ConversionContext ctx = new ConversionContext("a.py", "python", "javascript");

        sink.warn(ConversionWarning.of(WarningCode.SOURCE_EMPTY, ctx, "empty"));
        sink.warn(ConversionWarning.of(WarningCode.SOURCE_EMPTY, ctx, "empty"));
        sink.warn(ConversionWarning.of(WarningCode.SOURCE_EMPTY, ctx.withSourceLanguage("java"), "empty"));
        sink.warn(null);

        assertEquals(2, out.size());
        assertEquals("java", out.get(1).getSourceLanguage());
    }

    @Test
    void should_ignore_everything_in_null_sink() {
        ConversionWarningSink sink = ConversionWarningSink.none();
        sink.warn(ConversionWarning.of(WarningCode.LOW_CONFIDENCE, null, "x"));
        assertSame(sink, ConversionWarningSink.none());
    }
}
