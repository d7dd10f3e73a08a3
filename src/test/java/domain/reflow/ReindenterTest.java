package domain.reflow;

import domain.lint.FixApplier;
import domain.lint.LintFix;
import domain.lint.LintResult;
import domain.model.ListReflowEventSink;
import domain.model.ReflowEvent;
import domain.model.ReflowEventCode;
import domain.segment.Indent;
import domain.segment.RawSegment;
import domain.segment.Segment;
import domain.segment.SegmentKind;
import domain.segment.TemplateSegment;
import domain.segment.TreeBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static domain.segment.TreeBuilder.node;
import static org.junit.jupiter.api.Assertions.*;

class ReindenterTest {

    private static ReflowSequence reindentAgain(ReflowSequence seq) {
        return ReflowSequence.fromRawSegments(
                seq.getRawSegments(), seq.getRootSegment(), seq.getReflowConfig(), seq.getDepthMap()
        ).reindent();
    }

    private static String applied(Segment root, ReflowSequence seq) {
        return FixApplier.render(FixApplier.apply(root.getRawSegments(), seq.getFixes()));
    }

    private static boolean hasEvent(List<ReflowEvent> events, ReflowEventCode code) {
        for (ReflowEvent e : events) {
            if (e.getCode() == code) return true;
        }
        return false;
    }

    // SELECT <indent> \n 1 <dedent>
    private static Segment selectOne(TreeBuilder t, String wrapperType) {
        RawSegment select = t.keyword("SELECT");
        Indent ind = t.indent();
        RawSegment nl = t.nl();
        RawSegment one = t.code("literal", "1");
        Indent ded = t.dedent();
        RawSegment eof = t.eof();
        return node("file", node(wrapperType, node("select_clause", select, ind, nl, one, ded)), eof);
    }

    @Test
    void indent_is_inserted_after_a_taken_indent() {
        TreeBuilder t = new TreeBuilder();
        Segment root = selectOne(t, "statement");
        List<ReflowEvent> events = new ArrayList<>();

        ReflowSequence seq = ReflowSequence.fromRoot(root, ReflowConfig.defaults())
                .withEventSink(new ListReflowEventSink(events))
                .reindent();

        assertEquals("SELECT\n    1", seq.getRaw());
        assertEquals(1, seq.getFixes().size());
        assertEquals(LintFix.EditType.CREATE_AFTER, seq.getFixes().get(0).getEditType());
        assertEquals("SELECT\n    1", applied(root, seq));
        assertTrue(hasEvent(events, ReflowEventCode.INDENT_CORRECTED), events.toString());

        // the report points at the token after the inserted whitespace
        List<LintResult> results = seq.getResults();
        assertEquals(1, results.size());
        assertEquals("1", results.get(0).getAnchor().getRaw());
        assertEquals(2, results.get(0).getLineNo());

        assertTrue(reindentAgain(seq).getFixes().isEmpty());
    }

    @Test
    void tab_indent_unit_is_used_for_inserted_indent() {
        TreeBuilder t = new TreeBuilder();
        Segment root = selectOne(t, "statement");
        ReflowConfig config = ReflowConfig.builder().indentUnit("tab").build();

        ReflowSequence seq = ReflowSequence.fromRoot(root, config).reindent();

        assertEquals("SELECT\n\t1", seq.getRaw());
    }

    @Test
    void invalid_indent_unit_fails_reindent() {
        TreeBuilder t = new TreeBuilder();
        Segment root = selectOne(t, "statement");
        ReflowConfig config = ReflowConfig.builder().indentUnit("bogus").build();

        ReflowSequence seq = ReflowSequence.fromRoot(root, config);
        ReflowConfigException ex = assertThrows(ReflowConfigException.class, seq::reindent);
        assertTrue(ex.getMessage().contains("bogus"), ex.getMessage());
    }

    @Test
    void lines_within_skipped_types_are_left_alone() {
        TreeBuilder t = new TreeBuilder();
        Segment root = selectOne(t, "script_content");
        ReflowConfig config = ReflowConfig.builder().skipIndentationIn("script_content").build();
        List<ReflowEvent> events = new ArrayList<>();

        ReflowSequence seq = ReflowSequence.fromRoot(root, config)
                .withEventSink(new ListReflowEventSink(events))
                .reindent();

        assertTrue(seq.getFixes().isEmpty());
        assertEquals("SELECT\n1", seq.getRaw());
        assertTrue(hasEvent(events, ReflowEventCode.INDENT_SKIPPED));
    }

    @Test
    void template_tags_of_one_block_share_a_balance() {
        TreeBuilder t = new TreeBuilder();
        RawSegment select = t.keyword("SELECT");
        Indent ind1 = t.indent();
        RawSegment nl1 = t.nl();
        RawSegment ws1 = t.ws("    ");
        TemplateSegment open = t.tag("{% for x in y %}", TemplateSegment.BLOCK_START, "loop-1");
        Indent ind2 = t.indent();
        RawSegment nl2 = t.nl();
        RawSegment ws2 = t.ws("        ");
        TemplateSegment close = t.tag("{% endfor %}", TemplateSegment.BLOCK_END, "loop-1");
        Indent ded1 = t.dedent();
        Indent ded2 = t.dedent();
        RawSegment nl3 = t.nl();
        RawSegment z = t.word("z");
        RawSegment eof = t.eof();
        Segment root = node("file",
                node("statement", select, ind1, nl1, ws1, open, ind2, nl2, ws2, close, ded1, ded2, nl3, z),
                eof);
        List<ReflowEvent> events = new ArrayList<>();

        ReflowSequence seq = ReflowSequence.fromRoot(root, ReflowConfig.defaults())
                .withEventSink(new ListReflowEventSink(events))
                .reindent();

        // both tags reach balance 1 across the markers before them
        assertEquals("SELECT\n    \n    \nz", seq.getRaw());
        assertEquals(1, seq.getFixes().size());
        assertEquals(LintFix.EditType.REPLACE, seq.getFixes().get(0).getEditType());
        assertSame(ws2, seq.getFixes().get(0).getAnchor());
        assertEquals("SELECT\n    \n    \nz", applied(root, seq));
        assertTrue(hasEvent(events, ReflowEventCode.TEMPLATE_LINES_REVISED));
        assertTrue(reindentAgain(seq).getFixes().isEmpty());
    }

    @Test
    void template_tags_without_a_shared_balance_take_the_lowest() {
        TreeBuilder t = new TreeBuilder();
        RawSegment select = t.keyword("SELECT");
        Indent ind1 = t.indent();
        RawSegment nl1 = t.nl();
        RawSegment ws1 = t.ws("    ");
        TemplateSegment open = t.tag("{% if x %}", TemplateSegment.BLOCK_START, "if-1");
        Indent ind2 = t.indent();
        RawSegment nl2 = t.nl();
        RawSegment ws2 = t.ws("        ");
        RawSegment b = t.word("b");
        RawSegment nl3 = t.nl();
        RawSegment ws3 = t.ws("        ");
        TemplateSegment close = t.tag("{% endif %}", TemplateSegment.BLOCK_END, "if-1");
        Indent ded1 = t.dedent();
        Indent ded2 = t.dedent();
        RawSegment nl4 = t.nl();
        RawSegment z = t.word("z");
        RawSegment eof = t.eof();
        Segment root = node("file",
                node("statement", select, ind1, nl1, ws1, open, ind2, nl2, ws2, b, nl3, ws3, close,
                        ded1, ded2, nl4, z),
                eof);

        ReflowSequence seq = ReflowSequence.fromRoot(root, ReflowConfig.defaults()).reindent();

        // tags at 1, and the line between them loses the level the tag opened
        assertEquals("SELECT\n    \n    b\n    \nz", seq.getRaw());
        assertEquals(2, seq.getFixes().size());
        assertSame(ws2, seq.getFixes().get(0).getAnchor());
        assertSame(ws3, seq.getFixes().get(1).getAnchor());
        assertTrue(reindentAgain(seq).getFixes().isEmpty());
    }

    @Test
    void loop_markers_at_different_balances_are_aligned() {
        TreeBuilder t = new TreeBuilder();
        TemplateSegment first = t.loop("loop-1");
        Indent ind1 = t.indent();
        Indent ind2 = t.indent();
        RawSegment nl1 = t.nl();
        RawSegment ws = t.ws("        ");
        TemplateSegment second = t.loop("loop-1");
        Indent ded1 = t.dedent();
        Indent ded2 = t.dedent();
        RawSegment nl2 = t.nl();
        RawSegment z = t.word("z");
        RawSegment eof = t.eof();
        Segment root = node("file",
                node("statement", first, ind1, ind2, nl1, ws, second, ded1, ded2, nl2, z), eof);
        List<ReflowEvent> events = new ArrayList<>();

        ReflowSequence seq = ReflowSequence.fromRoot(root, ReflowConfig.defaults())
                .withEventSink(new ListReflowEventSink(events))
                .reindent();

        assertEquals("\n\nz", seq.getRaw());
        assertEquals(1, seq.getFixes().size());
        assertEquals(LintFix.EditType.DELETE, seq.getFixes().get(0).getEditType());
        assertSame(ws, seq.getFixes().get(0).getAnchor());
        assertTrue(hasEvent(events, ReflowEventCode.TEMPLATE_LINES_REVISED));
    }

    @Test
    void comment_line_takes_the_indent_of_the_following_line() {
        TreeBuilder t = new TreeBuilder();
        RawSegment select = t.keyword("SELECT");
        Indent ind1 = t.indent();
        RawSegment nl1 = t.nl();
        RawSegment ws1 = t.ws("    ");
        RawSegment a = t.word("a");
        RawSegment nl2 = t.nl();
        RawSegment ws2 = t.ws("    ");
        RawSegment comment = t.comment("-- c");
        Indent ind2 = t.indent();
        RawSegment nl3 = t.nl();
        RawSegment ws3 = t.ws("        ");
        RawSegment b = t.word("b");
        Indent ded1 = t.dedent();
        Indent ded2 = t.dedent();
        RawSegment eof = t.eof();
        Segment root = node("file",
                node("statement", select, ind1, nl1, ws1, a, nl2, ws2, comment, ind2, nl3, ws3, b, ded1, ded2),
                eof);
        List<ReflowEvent> events = new ArrayList<>();

        ReflowSequence seq = ReflowSequence.fromRoot(root, ReflowConfig.defaults())
                .withEventSink(new ListReflowEventSink(events))
                .reindent();

        assertEquals("SELECT\n    a\n        -- c\n        b", seq.getRaw());
        assertEquals(1, seq.getFixes().size());
        LintFix fix = seq.getFixes().get(0);
        assertEquals(LintFix.EditType.REPLACE, fix.getEditType());
        assertSame(ws2, fix.getAnchor());
        assertEquals("        ", fix.getEditRaw());
        assertTrue(hasEvent(events, ReflowEventCode.COMMENT_LINE_ANCHORED));
        assertTrue(reindentAgain(seq).getFixes().isEmpty());
    }

    @Test
    void trailing_comment_lines_go_back_to_the_margin() {
        TreeBuilder t = new TreeBuilder();
        RawSegment select = t.keyword("SELECT");
        Indent ind = t.indent();
        RawSegment nl1 = t.nl();
        RawSegment ws1 = t.ws("    ");
        RawSegment a = t.word("a");
        RawSegment nl2 = t.nl();
        RawSegment ws2 = t.ws("    ");
        RawSegment comment = t.comment("-- tail");
        Indent ded = t.dedent();
        RawSegment eof = t.eof();
        Segment root = node("file",
                node("statement", select, ind, nl1, ws1, a, nl2, ws2, comment, ded), eof);
        List<ReflowEvent> events = new ArrayList<>();

        ReflowSequence seq = ReflowSequence.fromRoot(root, ReflowConfig.defaults())
                .withEventSink(new ListReflowEventSink(events))
                .reindent();

        assertEquals("SELECT\n    a\n-- tail", seq.getRaw());
        assertEquals(1, seq.getFixes().size());
        assertEquals(LintFix.EditType.DELETE, seq.getFixes().get(0).getEditType());
        assertSame(ws2, seq.getFixes().get(0).getAnchor());
        assertTrue(hasEvent(events, ReflowEventCode.COMMENT_LINE_ANCHORED));
    }

    @Test
    void layout_without_fixes_keeps_the_source_text() {
        TreeBuilder t = new TreeBuilder();
        RawSegment select = t.keyword("SELECT");
        Indent ind = t.indent();
        RawSegment nl = t.nl();
        RawSegment ws1 = t.ws("    ");
        RawSegment a = t.word("a");
        RawSegment comma = t.comma();
        RawSegment ws2 = t.ws(" ");
        RawSegment b = t.word("b");
        Indent ded = t.dedent();
        RawSegment eof = t.eof();
        Segment root = node("file",
                node("select_clause", select, ind, nl, ws1, a, comma, ws2, b, ded), eof);
        ReflowSequence seq = ReflowSequence.fromRoot(root, ReflowConfig.defaults());

        ReflowSequence respaced = seq.respace();
        ReflowSequence reindented = seq.reindent();
        ReflowSequence rebroken = seq.rebreak();

        for (ReflowSequence s : List.of(respaced, reindented, rebroken)) {
            assertTrue(s.getFixes().isEmpty(), s.getFixes().toString());
            assertEquals(root.getRaw(), s.getRaw());
        }
    }

    @Test
    void line_indent_is_deduced_from_the_preceding_newline() {
        TreeBuilder t = new TreeBuilder();
        RawSegment select = t.keyword("SELECT");
        RawSegment nl = t.nl();
        RawSegment ws1 = t.ws("    ");
        RawSegment a = t.word("a");
        RawSegment comma = t.comma();
        RawSegment ws2 = t.ws(" ");
        RawSegment b = t.word("b");
        RawSegment eof = t.eof();
        Segment root = node("file", node("select_clause", select, nl, ws1, a, comma, ws2, b), eof);

        assertEquals("    ", Reindenter.deduceLineIndent(b, root));
        assertEquals("    ", Reindenter.deduceLineIndent(ws1, root));
        assertEquals("", Reindenter.deduceLineIndent(select, root));
        assertThrows(IllegalArgumentException.class,
                () -> Reindenter.deduceLineIndent(new TreeBuilder().word("x"), root));
    }

    @Test
    void untaken_indent_closed_on_a_later_line_gets_a_break() {
        TreeBuilder t = new TreeBuilder();
        RawSegment select = t.keyword("SELECT");
        Indent ind = t.indent();
        RawSegment ws1 = t.ws(" ");
        RawSegment a = t.word("a");
        RawSegment comma = t.comma();
        RawSegment nl = t.nl();
        RawSegment ws2 = t.ws("    ");
        RawSegment b = t.word("b");
        Indent ded = t.dedent();
        RawSegment eof = t.eof();
        Segment root = node("file", node("select_clause", select, ind, ws1, a, comma, nl, ws2, b, ded), eof);
        List<ReflowEvent> events = new ArrayList<>();

        ReflowSequence seq = ReflowSequence.fromRoot(root, ReflowConfig.defaults())
                .withEventSink(new ListReflowEventSink(events))
                .reindent();

        assertEquals("SELECT\n    a,\n    b", seq.getRaw());
        assertEquals(1, seq.getFixes().size());
        assertSame(ws1, seq.getFixes().get(0).getAnchor());
        assertEquals("SELECT\n    a,\n    b", applied(root, seq));
        assertTrue(hasEvent(events, ReflowEventCode.MISSING_BREAK_ON_INDENT));
        assertTrue(reindentAgain(seq).getFixes().isEmpty());
    }

    @Test
    void taken_indent_closed_inline_gets_a_break_before_the_dedent() {
        TreeBuilder t = new TreeBuilder();
        RawSegment select = t.keyword("SELECT");
        Indent ind = t.indent();
        RawSegment nl = t.nl();
        RawSegment ws1 = t.ws("    ");
        RawSegment a = t.word("a");
        Indent ded = t.dedent();
        RawSegment ws2 = t.ws(" ");
        RawSegment from = t.keyword("FROM");
        RawSegment ws3 = t.ws(" ");
        RawSegment tbl = t.word("t");
        RawSegment eof = t.eof();
        Segment root = node("file",
                node("statement",
                        node("select_clause", select, ind, nl, ws1, a, ded),
                        ws2,
                        node("from_clause", from, ws3, tbl)),
                eof);
        List<ReflowEvent> events = new ArrayList<>();

        ReflowSequence seq = ReflowSequence.fromRoot(root, ReflowConfig.defaults())
                .withEventSink(new ListReflowEventSink(events))
                .reindent();

        assertEquals("SELECT\n    a\nFROM t", seq.getRaw());
        assertEquals(1, seq.getFixes().size());
        assertSame(ws2, seq.getFixes().get(0).getAnchor());
        assertEquals("SELECT\n    a\nFROM t", applied(root, seq));
        assertTrue(hasEvent(events, ReflowEventCode.MISSING_BREAK_ON_DEDENT));
    }

    @Test
    void leading_whitespace_of_the_file_is_removed() {
        TreeBuilder t = new TreeBuilder();
        RawSegment ws1 = t.ws("  ");
        RawSegment select = t.keyword("SELECT");
        RawSegment ws2 = t.ws(" ");
        RawSegment one = t.code("literal", "1");
        RawSegment eof = t.eof();
        Segment root = node("file", ws1, node("statement", select, ws2, one), eof);

        ReflowSequence seq = ReflowSequence.fromRoot(root, ReflowConfig.defaults()).reindent();

        assertEquals("SELECT 1", seq.getRaw());
        assertEquals(1, seq.getFixes().size());
        assertEquals(LintFix.EditType.DELETE, seq.getFixes().get(0).getEditType());
        assertSame(ws1, seq.getFixes().get(0).getAnchor());
    }

    @Test
    void untaken_indent_closed_on_the_same_line_is_fine() {
        TreeBuilder t = new TreeBuilder();
        Segment root = longSelect(t);
        ReflowConfig config = ReflowConfig.builder().maxLineLength(0).build();

        ReflowSequence seq = ReflowSequence.fromRoot(root, config).reindent();

        assertTrue(seq.getFixes().isEmpty());
        assertEquals("SELECT aaaaaaaaaa, bbbbbbbbbb FROM t", seq.getRaw());
    }

    // SELECT aaaaaaaaaa, bbbbbbbbbb FROM t
    private static Segment longSelect(TreeBuilder t) {
        RawSegment select = t.keyword("SELECT");
        Indent ind1 = t.indent();
        RawSegment ws1 = t.ws(" ");
        RawSegment a = t.word("aaaaaaaaaa");
        RawSegment comma = t.comma();
        RawSegment ws2 = t.ws(" ");
        RawSegment b = t.word("bbbbbbbbbb");
        Indent ded1 = t.dedent();
        RawSegment ws3 = t.ws(" ");
        RawSegment from = t.keyword("FROM");
        Indent ind2 = t.indent();
        RawSegment ws4 = t.ws(" ");
        RawSegment tbl = t.word("t");
        Indent ded2 = t.dedent();
        RawSegment eof = t.eof();
        return node("file",
                node("statement",
                        node("select_clause", select, ind1, ws1, a, comma, ws2, b, ded1),
                        ws3,
                        node("from_clause", from, ind2, ws4, tbl, ded2)),
                eof);
    }

    @Test
    void long_line_is_broken_at_its_outermost_indent() {
        TreeBuilder t = new TreeBuilder();
        Segment root = longSelect(t);
        ReflowConfig config = ReflowConfig.builder().maxLineLength(30).build();
        List<ReflowEvent> events = new ArrayList<>();

        ReflowSequence seq = ReflowSequence.fromRoot(root, config)
                .withEventSink(new ListReflowEventSink(events))
                .reindent();

        assertEquals("SELECT\n    aaaaaaaaaa, bbbbbbbbbb\nFROM t", seq.getRaw());
        assertEquals(2, seq.getFixes().size());
        assertEquals("SELECT\n    aaaaaaaaaa, bbbbbbbbbb\nFROM t", applied(root, seq));
        assertTrue(hasEvent(events, ReflowEventCode.LINE_BROKEN));
        assertFalse(hasEvent(events, ReflowEventCode.LINE_TOO_LONG));

        assertTrue(reindentAgain(seq).getFixes().isEmpty());
    }

    @Test
    void unbreakable_long_line_is_reported() {
        TreeBuilder t = new TreeBuilder();
        RawSegment select = t.keyword("SELECT");
        RawSegment ws = t.ws(" ");
        RawSegment col = t.word("a_very_long_column_name");
        RawSegment eof = t.eof();
        Segment root = node("file", node("statement", select, ws, col), eof);
        ReflowConfig config = ReflowConfig.builder().maxLineLength(10).build();
        List<ReflowEvent> events = new ArrayList<>();

        ReflowSequence seq = ReflowSequence.fromRoot(root, config)
                .withEventSink(new ListReflowEventSink(events))
                .reindent();

        assertTrue(seq.getFixes().isEmpty());
        assertTrue(hasEvent(events, ReflowEventCode.LINE_TOO_LONG));
    }

    @Test
    void reindent_refuses_pending_fixes() {
        TreeBuilder t = new TreeBuilder();
        RawSegment a = t.word("a");
        RawSegment eof = t.eof();
        Segment root = node("file", node("statement", a), eof);

        ReflowSequence seq = ReflowSequence.fromRoot(root, ReflowConfig.defaults())
                .insert(new RawSegment(SegmentKind.CODE, "identifier", "b", null, null), a,
                        InsertPosition.AFTER);

        assertThrows(IllegalStateException.class, seq::reindent);
    }

    @Test
    void crawl_registers_and_prunes_untaken_indents() {
        TreeBuilder t = new TreeBuilder();
        RawSegment a = t.word("a");
        Indent i1 = t.indent();
        Indent i2 = t.indent();
        RawSegment ws1 = t.ws(" ");
        RawSegment b = t.word("b");
        Indent d1 = t.dedent();
        RawSegment ws2 = t.ws(" ");
        RawSegment c = t.word("c");
        Indent d2 = t.dedent();
        RawSegment eof = t.eof();
        Segment root = node("file", node("statement", a, i1, i2, ws1, b, d1, ws2, c, d2), eof);
        List<ReflowElement> elements = ReflowSequence.fromRoot(root, ReflowConfig.defaults()).getElements();

        List<IndentPoint> points = Reindenter.crawlIndentPoints(elements);

        assertEquals(3, points.size());
        assertEquals(List.of(), points.get(0).getUntakenIndents());
        assertEquals(List.of(1, 2), points.get(1).getUntakenIndents());
        assertEquals(List.of(1), points.get(2).getUntakenIndents());
        for (int i = 0; i + 1 < points.size(); i++) {
            assertEquals(points.get(i).getClosingIndentBalance(), points.get(i + 1).getInitialIndentBalance());
        }
        assertEquals(0, points.get(2).getClosingIndentBalance());
    }

    @Test
    void desired_indent_ignores_untaken_indents_above_a_dip() {
        IndentPoint first = new IndentPoint(0, 0, -1, 2, 5, true, List.of(1, 2));
        IndentLine line = new IndentLine(2, List.of(first));

        assertEquals(1, line.desiredIndentUnits(List.of()));
        assertEquals(2, line.desiredIndentUnits(List.of(2)));
    }

    @Test
    void desired_indent_is_never_negative() {
        IndentPoint first = new IndentPoint(0, 0, 0, 0, 5, true, List.of(1, 2));
        IndentLine line = new IndentLine(0, List.of(first));

        assertEquals(0, line.desiredIndentUnits(new ArrayList<>()));
    }
}
