package domain.lint;

import domain.segment.RawSegment;
import domain.segment.SegmentKind;
import domain.segment.TreeBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FixApplierTest {

    @Test
    void fixes_are_applied_in_order() {
        TreeBuilder t = new TreeBuilder();
        RawSegment a = t.word("a");
        RawSegment ws = t.ws("   ");
        RawSegment b = t.word("b");
        RawSegment comma = new RawSegment(SegmentKind.CODE, "comma", ",", null, null);
        List<RawSegment> raws = List.of(a, ws, b);

        List<LintFix> fixes = List.of(
                LintFix.replace(ws, List.of(ws.edit(" "))),
                LintFix.createAfter(a, List.of(comma)),
                LintFix.createAfter(comma, List.of(RawSegment.newline())),
                LintFix.delete(b));

        assertEquals("a,\n ", FixApplier.render(FixApplier.apply(raws, fixes)));
        assertEquals("a   b", FixApplier.render(raws));
    }

    @Test
    void unknown_anchor_fails() {
        TreeBuilder t = new TreeBuilder();
        RawSegment a = t.word("a");
        RawSegment stray = t.word("b");

        assertThrows(IllegalStateException.class,
                () -> FixApplier.apply(List.of(a), List.of(LintFix.delete(stray))));
        assertThrows(IllegalArgumentException.class, () -> FixApplier.apply(null, List.of()));
    }

    @Test
    void deletion_gaining_content_becomes_replacement() {
        TreeBuilder t = new TreeBuilder();
        RawSegment ws = t.ws("  ");

        LintFix fix = LintFix.delete(ws, "Unexpected whitespace").withEdit(List.of(ws.edit(" ")));

        assertEquals(LintFix.EditType.REPLACE, fix.getEditType());
        assertEquals(" ", fix.getEditRaw());
        assertEquals("Unexpected whitespace", fix.getDescription());
        assertThrows(IllegalArgumentException.class, () -> LintFix.replace(ws, List.of()));
    }
}
