package domain.reflow;

import domain.segment.CompositeSegment;
import domain.segment.RawSegment;
import domain.segment.Segment;
import domain.segment.TreeBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static domain.segment.TreeBuilder.node;
import static org.junit.jupiter.api.Assertions.*;

class DepthMapTest {

    @Test
    void depth_is_the_ancestor_chain() {
        TreeBuilder t = new TreeBuilder();
        RawSegment select = t.keyword("SELECT");
        RawSegment ws = t.ws(" ");
        RawSegment open = t.code("start_bracket", "(");
        RawSegment x = t.word("x");
        RawSegment close = t.code("end_bracket", ")");
        RawSegment eof = t.eof();
        CompositeSegment bracketed = node("bracketed", open, x, close);
        Segment root = node("file", node("statement", select, ws, bracketed), eof);

        DepthMap map = DepthMap.fromParent(root);

        assertEquals(2, map.getDepthInfo(select).getStackDepth());
        assertEquals(3, map.getDepthInfo(x).getStackDepth());
        assertEquals(1, map.getDepthInfo(eof).getStackDepth());
        assertEquals(1, map.getDepthInfo(select).deepestCommonLevel(map.getDepthInfo(x)));
        assertEquals(2, map.getDepthInfo(open).deepestCommonLevel(map.getDepthInfo(close)));
        assertTrue(map.getDepthInfo(x).isWithinAny(Set.of("bracketed")));
        assertFalse(map.getDepthInfo(select).isWithinAny(Set.of("bracketed")));
    }

    @Test
    void raws_and_root_route_matches_single_walk() {
        TreeBuilder t = new TreeBuilder();
        RawSegment a = t.word("a");
        RawSegment ws = t.ws(" ");
        RawSegment b = t.word("b");
        RawSegment eof = t.eof();
        Segment root = node("file", node("statement", a, ws, node("expression", b)), eof);

        DepthMap full = DepthMap.fromParent(root);
        DepthMap partial = DepthMap.fromRawsAndRoot(List.of(a, b), root);

        assertEquals(full.getDepthInfo(b).getStack(), partial.getDepthInfo(b).getStack());
        assertFalse(partial.contains(eof));
        assertThrows(IllegalArgumentException.class, () -> partial.getDepthInfo(eof));
    }

    @Test
    void copied_depth_can_be_trimmed() {
        TreeBuilder t = new TreeBuilder();
        RawSegment x = t.word("x");
        RawSegment eof = t.eof();
        Segment root = node("file", node("statement", node("expression", x)), eof);
        DepthMap map = DepthMap.fromParent(root);
        RawSegment copy = x.detachedCopy();
        RawSegment trimmed = x.detachedCopy();

        map.copyDepthInfo(x, copy);
        map.copyDepthInfo(x, trimmed, 2);

        assertEquals(3, map.getDepthInfo(copy).getStackDepth());
        assertEquals(1, map.getDepthInfo(trimmed).getStackDepth());
        assertThrows(IllegalArgumentException.class, () -> map.getDepthInfo(x).trim(4));
    }

    @Test
    void lookalike_ancestors_are_not_shared() {
        TreeBuilder t = new TreeBuilder();
        RawSegment a = t.word("a");
        RawSegment ws = t.ws(" ");
        RawSegment b = t.word("b");
        RawSegment eof = t.eof();
        Segment root = node("file", node("expression", a), ws, node("expression", b), eof);
        DepthMap map = DepthMap.fromParent(root);

        assertEquals(map.getDepthInfo(a).getStackClassTypes(), map.getDepthInfo(b).getStackClassTypes());
        assertEquals(0, map.getDepthInfo(a).deepestCommonLevel(map.getDepthInfo(b)));
    }
}
