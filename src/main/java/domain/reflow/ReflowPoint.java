package domain.reflow;

import domain.lint.LintFix;
import domain.segment.Indent;
import domain.segment.RawSegment;
import domain.segment.Segment;
import domain.segment.SegmentKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reflow element holding the (possibly empty) run of spacing tokens between two blocks:
 * whitespace, newlines, indent markers and templated whitespace.
 *
 * <p>Points never hold content. Every edit returns a new point together with the fixes
 * that turn the original tokens into the new ones.</p>
 */
public final class ReflowPoint extends ReflowElement {

    public ReflowPoint(List<RawSegment> segments) {
        super(segments);
    }

    public static ReflowPoint empty() {
        return new ReflowPoint(Collections.emptyList());
    }

    /** True for tokens that belong in a point rather than a block. */
    public static boolean isSpacing(RawSegment seg) {
        SegmentKind k = seg.getKind();
        if (k == SegmentKind.WHITESPACE || k == SegmentKind.NEWLINE || k == SegmentKind.INDENT) return true;
        String consumed = seg.getConsumedWhitespace();
        return consumed != null && !consumed.isEmpty() && consumed.isBlank();
    }

    /**
     * Net indent change across this point and the lowest running balance reached on the way.
     */
    public IndentImpulse getIndentImpulse() {
        int running = 0;
        int trough = 0;
        for (RawSegment seg : getSegments()) {
            if (seg instanceof Indent) {
                running += ((Indent) seg).getIndentVal();
                trough = Math.min(trough, running);
            }
        }
        return new IndentImpulse(running, trough);
    }

    /**
     * Indent after the last newline: "" when there is none, null when there is no newline.
     */
    public String getIndent() {
        if (getNumNewlines() == 0) return null;
        RawSegment seg = getIndentSegment();
        return seg == null ? "" : seg.getRaw();
    }

    RawSegment getIndentSegment() {
        RawSegment indent = null;
        List<RawSegment> segs = getSegments();
        for (int i = segs.size() - 1; i >= 0; i--) {
            RawSegment seg = segs.get(i);
            if (seg.getKind() == SegmentKind.NEWLINE) return indent;
            if (seg.getKind() == SegmentKind.WHITESPACE) indent = seg;
        }
        return null;
    }

    /**
     * Make this point end with a line break followed by {@code desiredIndent}.
     *
     * <p>When a token has to be created and the point has no whitespace to convert, the new
     * tokens are placed before {@code before} or, failing that, after {@code after}.</p>
     */
    public Result indentTo(String desiredIndent, RawSegment before, RawSegment after, String description) {
        String desired = desiredIndent == null ? "" : desiredIndent;
        List<RawSegment> segs = getSegments();
        RawSegment indentSeg = getIndentSegment();

        if (getNumNewlines() > 0) {
            if (desired.isEmpty()) {
                if (indentSeg == null) return new Result(Collections.emptyList(), this);
                return new Result(
                        List.of(LintFix.delete(indentSeg, description)),
                        new ReflowPoint(without(segs, indentSeg))
                );
            }
            if (indentSeg != null) {
                if (indentSeg.getRaw().equals(desired)) return new Result(Collections.emptyList(), this);
                RawSegment newIndent = indentSeg.edit(desired);
                return new Result(
                        List.of(LintFix.replace(indentSeg, List.of(newIndent), description)),
                        new ReflowPoint(substitute(segs, indentSeg, List.of(newIndent)))
                );
            }
            // A newline without indent. Indent goes right after the last newline.
            int nlIdx = lastNewlineIndex(segs);
            RawSegment newline = segs.get(nlIdx);
            RawSegment newIndent = RawSegment.whitespace(desired);
            List<RawSegment> out = new ArrayList<>(segs);
            if (newline.getPositionMarker() == null && before != null) {
                out.add(newIndent);
                return new Result(List.of(LintFix.createBefore(before, List.of(newIndent), description)), new ReflowPoint(out));
            }
            out.add(nlIdx + 1, newIndent);
            return new Result(List.of(LintFix.createAfter(newline, List.of(newIndent), description)), new ReflowPoint(out));
        }

        List<RawSegment> newSegs = new ArrayList<>(2);
        newSegs.add(RawSegment.newline());

        RawSegment wsSeg = null;
        for (RawSegment seg : segs) {
            if (seg.getKind() == SegmentKind.WHITESPACE) {
                wsSeg = seg;
                break;
            }
        }

        if (wsSeg == null) {
            if (!desired.isEmpty()) newSegs.add(RawSegment.whitespace(desired));
            if (before != null) {
                List<RawSegment> out = new ArrayList<>(segs);
                out.addAll(newSegs);
                return new Result(List.of(LintFix.createBefore(before, newSegs, description)), new ReflowPoint(out));
            } else if (after != null) {
                List<RawSegment> out = new ArrayList<>(newSegs);
                out.addAll(segs);
                return new Result(List.of(LintFix.createAfter(after, newSegs, description)), new ReflowPoint(out));
            }
            throw new IllegalArgumentException("indentTo() needs a before or after anchor to create a line break");
        }

        // Coerce the existing whitespace into a newline and indent.
        if (!desired.isEmpty()) newSegs.add(wsSeg.edit(desired));
        return new Result(
                List.of(LintFix.replace(wsSeg, newSegs, description)),
                new ReflowPoint(substitute(segs, wsSeg, newSegs))
        );
    }

    /**
     * Recompute horizontal spacing from the policies of the adjacent blocks.
     *
     * <p>{@code fixes} are the fixes already embodied by the sequence. When a whitespace token
     * to change was itself introduced by one of them, that fix is amended rather than
     * anchoring a new fix on a token that is not in the source. The returned fix list is the
     * complete, updated list.</p>
     */
    public Result respace(ReflowBlock prevBlock, ReflowBlock nextBlock, List<LintFix> fixes, boolean stripNewlines) {
        List<RawSegment> segs = new ArrayList<>(getSegments());
        List<LintFix> out = new ArrayList<>(fixes == null ? Collections.emptyList() : fixes);

        if (stripNewlines) {
            for (RawSegment seg : new ArrayList<>(segs)) {
                if (seg.getKind() == SegmentKind.NEWLINE) removeSegment(segs, out, seg, "Remove line break.");
            }
        }

        boolean hasNewline = false;
        for (RawSegment seg : segs) {
            if (seg.getKind() == SegmentKind.NEWLINE) hasNewline = true;
        }

        if (hasNewline) {
            for (RawSegment seg : new ArrayList<>(segs)) {
                if (seg.getKind() == SegmentKind.WHITESPACE && isFollowedByNewline(segs, seg)) {
                    removeSegment(segs, out, seg, "Unnecessary trailing whitespace.");
                }
            }
            if (nextBlock == null || nextBlock.isEndOfFile()) {
                int nl = lastNewlineIndex(segs);
                for (RawSegment seg : new ArrayList<>(segs.subList(nl + 1, segs.size()))) {
                    if (seg.getKind() == SegmentKind.WHITESPACE) {
                        removeSegment(segs, out, seg, "Unnecessary trailing whitespace at end of file.");
                    }
                }
            }
            return new Result(out, new ReflowPoint(segs));
        }

        // Leading whitespace of the file is a matter for reindent.
        if (prevBlock == null) return new Result(out, new ReflowPoint(segs));

        if (nextBlock == null || nextBlock.isEndOfFile()) {
            for (RawSegment seg : whitespaceOf(segs)) {
                removeSegment(segs, out, seg, "Unnecessary trailing whitespace at end of file.");
            }
            return new Result(out, new ReflowPoint(segs));
        }

        Spacing spacing = resolveSpacing(prevBlock, nextBlock);
        if (spacing == Spacing.ANY) return new Result(out, new ReflowPoint(segs));

        List<RawSegment> whitespace = whitespaceOf(segs);
        if (spacing == Spacing.TOUCH) {
            for (RawSegment seg : whitespace) {
                removeSegment(segs, out, seg, "Unexpected whitespace before " + describe(nextBlock) + ".");
            }
            return new Result(out, new ReflowPoint(segs));
        }

        if (whitespace.isEmpty()) {
            for (RawSegment seg : segs) {
                // templated whitespace already separates the blocks
                if (isSpacing(seg) && seg.getConsumedWhitespace() != null) return new Result(out, new ReflowPoint(segs));
            }
            createWhitespace(segs, out, RawSegment.whitespace(" "), prevBlock, nextBlock,
                    "Expected single whitespace between " + describe(prevBlock) + " and " + describe(nextBlock) + ".");
            return new Result(out, new ReflowPoint(segs));
        }
        RawSegment first = whitespace.get(0);
        if (!first.getRaw().equals(" ")) {
            replaceSegment(segs, out, first, first.edit(" "), "Expected only single space before " + describe(nextBlock) + ".");
        }
        for (RawSegment extra : whitespace.subList(1, whitespace.size())) {
            removeSegment(segs, out, extra, "Expected only single space before " + describe(nextBlock) + ".");
        }
        return new Result(out, new ReflowPoint(segs));
    }

    /**
     * Spacing between two adjacent blocks: a shared ancestor's spacing_within wins, then
     * {@code any} on either side, then {@code touch} on either side, otherwise single.
     */
    static Spacing resolveSpacing(ReflowBlock prev, ReflowBlock next) {
        int level = prev.getDepthInfo().deepestCommonLevel(next.getDepthInfo());
        Spacing within = prev.getSpacingWithinAt(level);
        if (within != null) return within;
        if (prev.getSpacingAfter() == Spacing.ANY || next.getSpacingBefore() == Spacing.ANY) return Spacing.ANY;
        if (prev.getSpacingAfter() == Spacing.TOUCH || next.getSpacingBefore() == Spacing.TOUCH) return Spacing.TOUCH;
        return Spacing.SINGLE;
    }

    // ------------------------------------------------------------
    // fix bookkeeping
    // ------------------------------------------------------------

    private static void removeSegment(List<RawSegment> segs, List<LintFix> fixes, RawSegment seg, String description) {
        segs.remove(indexOf(segs, seg));
        int fi = findIntroducingFix(fixes, seg);
        if (fi < 0) {
            fixes.add(LintFix.delete(seg, description));
            return;
        }
        LintFix fix = fixes.get(fi);
        List<Segment> edit = new ArrayList<>(fix.getEdit());
        edit.remove(indexOfSegment(edit, seg));
        if (!edit.isEmpty()) {
            fixes.set(fi, fix.withEdit(edit));
        } else if (fix.getEditType() == LintFix.EditType.REPLACE) {
            fixes.set(fi, LintFix.delete(fix.getAnchor(), fix.getDescription()));
        } else {
            fixes.remove(fi);
        }
    }

    private static void replaceSegment(
            List<RawSegment> segs, List<LintFix> fixes, RawSegment old, RawSegment replacement, String description) {
        segs.set(indexOf(segs, old), replacement);
        int fi = findIntroducingFix(fixes, old);
        if (fi < 0) {
            fixes.add(LintFix.replace(old, List.of(replacement), description));
            return;
        }
        LintFix fix = fixes.get(fi);
        List<Segment> edit = new ArrayList<>(fix.getEdit());
        edit.set(indexOfSegment(edit, old), replacement);
        fixes.set(fi, fix.withEdit(edit));
    }

    private static void createWhitespace(
            List<RawSegment> segs, List<LintFix> fixes, RawSegment ws,
            ReflowBlock prev, ReflowBlock next, String description) {
        RawSegment nextTok = next.getSegment();
        RawSegment prevTok = prev.getSegment();
        int nextFix = findIntroducingFix(fixes, nextTok);
        int prevFix = findIntroducingFix(fixes, prevTok);

        if (nextFix < 0) {
            segs.add(ws);
            fixes.add(LintFix.createBefore(nextTok, List.of(ws), description));
        } else if (prevFix < 0) {
            segs.add(0, ws);
            fixes.add(LintFix.createAfter(prevTok, List.of(ws), description));
        } else {
            // Both neighbours are new: extend the fix that creates the next one.
            LintFix fix = fixes.get(nextFix);
            List<Segment> edit = new ArrayList<>(fix.getEdit());
            edit.add(indexOfSegment(edit, nextTok), ws);
            fixes.set(nextFix, fix.withEdit(edit));
            segs.add(ws);
        }
    }

    private static int findIntroducingFix(List<LintFix> fixes, RawSegment seg) {
        for (int i = 0; i < fixes.size(); i++) {
            if (fixes.get(i).introduces(seg)) return i;
        }
        return -1;
    }

    private static int indexOfSegment(List<Segment> edit, RawSegment seg) {
        for (int i = 0; i < edit.size(); i++) {
            if (edit.get(i) == seg) return i;
        }
        throw new IllegalStateException("Segment is nested inside a composite edit and cannot be amended: " + seg);
    }

    // ------------------------------------------------------------
    // list helpers (identity based)
    // ------------------------------------------------------------

    private static int indexOf(List<RawSegment> segs, RawSegment target) {
        for (int i = 0; i < segs.size(); i++) {
            if (segs.get(i) == target) return i;
        }
        throw new IllegalArgumentException("Segment not in point: " + target);
    }

    private static List<RawSegment> without(List<RawSegment> segs, RawSegment target) {
        List<RawSegment> out = new ArrayList<>(segs);
        out.remove(indexOf(out, target));
        return out;
    }

    private static List<RawSegment> substitute(List<RawSegment> segs, RawSegment target, List<RawSegment> replacement) {
        List<RawSegment> out = new ArrayList<>(segs);
        int idx = indexOf(out, target);
        out.remove(idx);
        out.addAll(idx, replacement);
        return out;
    }

    private static int lastNewlineIndex(List<RawSegment> segs) {
        for (int i = segs.size() - 1; i >= 0; i--) {
            if (segs.get(i).getKind() == SegmentKind.NEWLINE) return i;
        }
        return -1;
    }

    private static boolean isFollowedByNewline(List<RawSegment> segs, RawSegment seg) {
        for (int i = indexOf(segs, seg) + 1; i < segs.size(); i++) {
            SegmentKind k = segs.get(i).getKind();
            if (k == SegmentKind.NEWLINE) return true;
            if (k != SegmentKind.INDENT) return false;
        }
        return false;
    }

    private static List<RawSegment> whitespaceOf(List<RawSegment> segs) {
        List<RawSegment> out = new ArrayList<>();
        for (RawSegment seg : segs) {
            if (seg.getKind() == SegmentKind.WHITESPACE) out.add(seg);
        }
        return out;
    }

    private static String describe(ReflowBlock block) {
        return block.getSegment().getType() + " '" + block.getSegment().getRaw() + "'";
    }

    /** A new point plus the fixes that produce it. */
    public static final class Result {

        private final List<LintFix> fixes;
        private final ReflowPoint point;

        Result(List<LintFix> fixes, ReflowPoint point) {
            this.fixes = Collections.unmodifiableList(new ArrayList<>(fixes));
            this.point = point;
        }

        public List<LintFix> getFixes() {
            return fixes;
        }

        public ReflowPoint getPoint() {
            return point;
        }
    }
}
