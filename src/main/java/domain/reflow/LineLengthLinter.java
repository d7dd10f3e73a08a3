package domain.reflow;

import domain.lint.LintFix;
import domain.model.ReflowEvent;
import domain.model.ReflowEventCode;
import domain.model.ReflowEventSink;
import domain.segment.RawSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Breaks lines longer than the configured maximum at their indent structure.
 *
 * <p>A long line is broken at its outermost opening point (an indent with no dip before
 * it) and at the first later point on the same line that returns to that depth. The part
 * in between goes one level deeper. This repeats until no long line has a break left.</p>
 */
final class LineLengthLinter {

    private static final Logger log = LoggerFactory.getLogger(LineLengthLinter.class);

    private LineLengthLinter() {
    }

    static LintedElements lintLineLength(
            List<ReflowElement> elements,
            String singleIndent,
            int maxLineLength,
            ReflowEventSink sink
    ) {
        ReflowEventSink events = sink == null ? ReflowEventSink.none() : sink;
        List<ReflowElement> buffer = new ArrayList<>(elements);
        List<LintFix> fixes = new ArrayList<>();
        if (maxLineLength <= 0) return new LintedElements(buffer, fixes);

        // Every round turns one inline point into a break, so this always terminates.
        for (int round = 0; round <= buffer.size(); round++) {
            int[] balances = balancesBefore(buffer);
            boolean changed = false;
            for (Line line : mapLines(buffer)) {
                if (line.length <= maxLineLength) continue;
                Integer open = findOpening(buffer, line, balances);
                if (open == null) continue;

                log.debug("Line of {} chars exceeds {}; breaking at element {}", line.length, maxLineLength, open);
                IndentImpulse openImpulse = ((ReflowPoint) buffer.get(open)).getIndentImpulse();
                Integer close = findClosing(buffer, line, open, balances);
                if (close != null) {
                    IndentImpulse closeImpulse = ((ReflowPoint) buffer.get(close)).getIndentImpulse();
                    int delta = balances[close] + closeImpulse.getImpulse() - balances[open];
                    breakAt(buffer, close, shift(line.indent, singleIndent, delta), fixes, events, maxLineLength);
                }
                breakAt(buffer, open, shift(line.indent, singleIndent, openImpulse.getImpulse()), fixes, events, maxLineLength);
                changed = true;
                break;
            }
            if (!changed) break;
        }

        for (Line line : mapLines(buffer)) {
            if (line.length <= maxLineLength) continue;
            RawSegment at = firstSegmentOf(buffer, line);
            log.debug("Line of {} chars cannot be broken: {}", line.length, at);
            events.emit(ReflowEvent.at(ReflowEventCode.LINE_TOO_LONG, at,
                    "line exceeds " + maxLineLength + " characters", "length=" + line.length));
        }
        return new LintedElements(buffer, fixes);
    }

    private static void breakAt(
            List<ReflowElement> buffer,
            int idx,
            String indent,
            List<LintFix> fixes,
            ReflowEventSink events,
            int maxLineLength
    ) {
        RawSegment before = buffer.get(idx + 1).getSegments().get(0);
        List<RawSegment> prevSegs = buffer.get(idx - 1).getSegments();
        RawSegment after = prevSegs.get(prevSegs.size() - 1);
        ReflowPoint.Result r = ((ReflowPoint) buffer.get(idx)).indentTo(indent, before, after,
                "Line is too long (max " + maxLineLength + "). Break before " + before.getType() + ".");
        buffer.set(idx, r.getPoint());
        fixes.addAll(r.getFixes());
        events.emit(ReflowEvent.at(ReflowEventCode.LINE_BROKEN, before,
                "line break inserted", "indent='" + indent + "'"));
    }

    // Lowest-balance indent on the line that does not dip first; earliest wins a tie.
    private static Integer findOpening(List<ReflowElement> buffer, Line line, int[] balances) {
        Integer best = null;
        for (int idx : line.points) {
            if (!isBreakable(buffer, idx)) continue;
            IndentImpulse ii = ((ReflowPoint) buffer.get(idx)).getIndentImpulse();
            if (ii.getImpulse() <= 0 || ii.getTrough() != 0) continue;
            if (best == null || balances[idx] < balances[best]) best = idx;
        }
        return best;
    }

    private static Integer findClosing(List<ReflowElement> buffer, Line line, int open, int[] balances) {
        for (int idx : line.points) {
            if (idx <= open) continue;
            IndentImpulse ii = ((ReflowPoint) buffer.get(idx)).getIndentImpulse();
            if (balances[idx] + ii.getTrough() <= balances[open]) {
                return isBreakable(buffer, idx) ? idx : null;
            }
        }
        return null;
    }

    private static boolean isBreakable(List<ReflowElement> buffer, int idx) {
        if (idx == 0 || idx + 1 >= buffer.size()) return false;
        ReflowElement next = buffer.get(idx + 1);
        return next instanceof ReflowBlock && !((ReflowBlock) next).isEndOfFile();
    }

    private static String shift(String indent, String singleIndent, int units) {
        if (units >= 0) return indent + singleIndent.repeat(units);
        int cut = Math.min(indent.length(), singleIndent.length() * -units);
        return indent.substring(0, indent.length() - cut);
    }

    private static int[] balancesBefore(List<ReflowElement> buffer) {
        int[] out = new int[buffer.size()];
        int balance = 0;
        for (int i = 0; i < buffer.size(); i++) {
            out[i] = balance;
            if (buffer.get(i) instanceof ReflowPoint) {
                balance += ((ReflowPoint) buffer.get(i)).getIndentImpulse().getImpulse();
            }
        }
        return out;
    }

    private static List<Line> mapLines(List<ReflowElement> buffer) {
        List<Line> lines = new ArrayList<>();
        Line current = new Line(-1, "");
        for (int idx = 0; idx < buffer.size(); idx++) {
            ReflowElement e = buffer.get(idx);
            String raw = e.getRaw();
            if (e instanceof ReflowPoint && e.getNumNewlines() > 0) {
                current.length += raw.indexOf('\n');
                lines.add(current);
                String indent = ((ReflowPoint) e).getIndent();
                current = new Line(idx, indent == null ? "" : indent);
                current.length = raw.length() - raw.lastIndexOf('\n') - 1;
                continue;
            }
            if (e instanceof ReflowPoint) {
                if (idx == 0) current.indent = raw;
                current.points.add(idx);
            }
            current.length += raw.length();
        }
        lines.add(current);
        return lines;
    }

    private static RawSegment firstSegmentOf(List<ReflowElement> buffer, Line line) {
        int from = Math.max(0, line.startIdx);
        for (int i = from; i < buffer.size(); i++) {
            if (buffer.get(i) instanceof ReflowBlock) return ((ReflowBlock) buffer.get(i)).getSegment();
        }
        return null;
    }

    private static final class Line {
        final int startIdx;
        String indent;
        int length;
        final List<Integer> points = new ArrayList<>();

        Line(int startIdx, String indent) {
            this.startIdx = startIdx;
            this.indent = indent;
        }
    }
}
