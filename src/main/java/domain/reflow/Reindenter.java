package domain.reflow;

import domain.lint.LintFix;
import domain.model.ReflowEvent;
import domain.model.ReflowEventCode;
import domain.model.ReflowEventSink;
import domain.segment.Indent;
import domain.segment.RawSegment;
import domain.segment.Segment;
import domain.segment.SegmentKind;
import domain.segment.TemplateSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deduces line breaks and indentation from the indent markers of a sequence.
 *
 * <p>Two things are fixed together, because an inserted break needs an indent and an
 * indent is only meaningful at a break:</p>
 * <ol>
 *   <li>Untaken indents. An indent without a break is only valid when its dedent is on the
 *   same line; otherwise breaks are inserted at the indent and at the dedent.</li>
 *   <li>The leading whitespace of every line.</li>
 * </ol>
 */
public final class Reindenter {

    private static final Logger log = LoggerFactory.getLogger(Reindenter.class);

    private Reindenter() {
    }

    /**
     * Indent of the line {@code raw} sits on: the whitespace that follows the line's newline,
     * or {@code ""} when code comes first.
     *
     * @throws IllegalArgumentException when {@code raw} is not a token of {@code root}
     */
    public static String deduceLineIndent(RawSegment raw, Segment root) {
        if (raw == null || root == null) throw new IllegalArgumentException("raw and root are required");
        List<RawSegment> raws = root.getRawSegments();
        int segIdx = -1;
        for (int i = 0; i < raws.size(); i++) {
            if (raws.get(i) == raw) {
                segIdx = i;
                break;
            }
        }
        if (segIdx < 0) throw new IllegalArgumentException("Raw segment is not part of the root: " + raw);

        RawSegment indentSeg = null;
        for (int i = segIdx; i >= 0; i--) {
            RawSegment seg = raws.get(i);
            if (seg.isCode()) {
                indentSeg = null;
            } else if (seg.getKind() == SegmentKind.WHITESPACE) {
                indentSeg = seg;
            } else if (seg.getKind() == SegmentKind.NEWLINE) {
                break;
            }
        }
        log.debug("Deduced indent for {} as {}", raw, indentSeg);
        return indentSeg == null ? "" : indentSeg.getRaw();
    }

    static LintedElements lintIndentPoints(
            List<ReflowElement> elements,
            String singleIndent,
            Set<String> skipIndentationIn,
            ReflowEventSink sink
    ) {
        ReflowEventSink events = sink == null ? ReflowEventSink.none() : sink;
        Set<String> skip = skipIndentationIn == null ? Collections.emptySet() : skipIndentationIn;

        List<IndentLine> lines = mapLineBuffers(elements);
        reviseTemplatedLines(lines, elements, events);
        reviseCommentLines(lines, elements, events);

        List<LintFix> fixes = new ArrayList<>();
        List<Integer> forcedIndents = new ArrayList<>();
        List<ReflowElement> elemBuffer = new ArrayList<>(elements);
        for (IndentLine line : lines) {
            List<ReflowBlock> blocks = line.blocks(elemBuffer);
            if (!skip.isEmpty() && !blocks.isEmpty() && blocks.get(0).getDepthInfo().isWithinAny(skip)) {
                log.debug("Skipping line within {}: {}", skip, line);
                events.emit(ReflowEvent.at(ReflowEventCode.INDENT_SKIPPED, blocks.get(0).getSegment(),
                        "line not reindented", String.join(",", skip)));
                forcedIndents.removeIf(i -> i > line.last().getClosingIndentBalance());
                continue;
            }
            fixes.addAll(evaluateIndentPointBuffer(elemBuffer, line, singleIndent, forcedIndents, events));
        }
        return new LintedElements(elemBuffer, fixes);
    }

    // ------------------------------------------------------------
    // mapping
    // ------------------------------------------------------------

    static List<IndentPoint> crawlIndentPoints(List<ReflowElement> elements) {
        List<IndentPoint> out = new ArrayList<>();
        Integer lastLineBreakIdx = null;
        int indentBalance = 0;
        List<Integer> untakenIndents = new ArrayList<>();

        for (int idx = 0; idx < elements.size(); idx++) {
            if (!(elements.get(idx) instanceof ReflowPoint)) continue;
            ReflowPoint point = (ReflowPoint) elements.get(idx);
            IndentImpulse ii = point.getIndentImpulse();
            int impulse = ii.getImpulse();
            int trough = ii.getTrough();

            if (point.getNumNewlines() > 0 && (lastLineBreakIdx == null || idx != lastLineBreakIdx)) {
                out.add(new IndentPoint(idx, impulse, trough, indentBalance, lastLineBreakIdx, true,
                        new ArrayList<>(untakenIndents)));
                lastLineBreakIdx = idx;
            } else if (impulse != 0 || trough != 0 || idx == 0) {
                // A point at the very start matters like an indent would.
                out.add(new IndentPoint(idx, impulse, trough, indentBalance, lastLineBreakIdx, false,
                        new ArrayList<>(untakenIndents)));
                for (int i = 0; i < impulse; i++) {
                    untakenIndents.add(indentBalance + i + 1);
                }
            } else if (idx + 1 < elements.size() && elements.get(idx + 1) instanceof ReflowBlock
                    && ((ReflowBlock) elements.get(idx + 1)).isEndOfFile()) {
                // The end of the file closes the last line.
                out.add(new IndentPoint(idx, impulse, trough, indentBalance, lastLineBreakIdx, true,
                        new ArrayList<>(untakenIndents)));
            }

            indentBalance += impulse;
            int balance = indentBalance;
            untakenIndents.removeIf(x -> x > balance);
        }
        return out;
    }

    static List<IndentLine> mapLineBuffers(List<ReflowElement> elements) {
        List<IndentLine> lines = new ArrayList<>();
        List<IndentPoint> pointBuffer = new ArrayList<>();
        for (IndentPoint ip : crawlIndentPoints(elements)) {
            pointBuffer.add(ip);
            if (!ip.isLineBreak()) continue;
            lines.add(IndentLine.fromPoints(pointBuffer));
            pointBuffer = new ArrayList<>();
            pointBuffer.add(ip);
        }
        if (pointBuffer.size() > 1) {
            lines.add(IndentLine.fromPoints(pointBuffer));
        }
        return lines;
    }

    // ------------------------------------------------------------
    // revision
    // ------------------------------------------------------------

    /**
     * Align the lone template tags of one block (matched by block id).
     *
     * <ol>
     *   <li>Already on one balance: unchanged.</li>
     *   <li>A balance reachable by every tag through the markers of the point before it,
     *   and below every line between the first and last tag: the lowest such balance.</li>
     *   <li>Otherwise the lowest balance of the tags, and every other line between them
     *   loses one level.</li>
     * </ol>
     */
    static void reviseTemplatedLines(List<IndentLine> lines, List<ReflowElement> elements, ReflowEventSink events) {
        Map<String, List<Integer>> grouped = new LinkedHashMap<>();
        for (int idx = 0; idx < lines.size(); idx++) {
            IndentLine line = lines.get(idx);
            if (!line.isAllTemplates(elements)) continue;
            RawSegment tag = line.closingTag(elements);
            if (!(tag instanceof TemplateSegment)) continue;
            String uuid = ((TemplateSegment) tag).getBlockUuid();
            if (uuid == null) continue;
            grouped.computeIfAbsent(uuid, k -> new ArrayList<>()).add(idx);
        }

        for (Map.Entry<String, List<Integer>> group : grouped.entrySet()) {
            List<Integer> groupLines = group.getValue();
            log.debug("Evaluating template block {}: lines {}", group.getKey(), groupLines);

            Set<Integer> balances = new HashSet<>();
            for (int idx : groupLines) balances.add(lines.get(idx).getInitialIndentBalance());
            if (balances.size() == 1) {
                log.debug("    Case 1: All the same");
                continue;
            }

            Set<Integer> overlap = null;
            for (int idx : groupLines) {
                Set<Integer> steps = balanceOptions(lines.get(idx), elements);
                if (overlap == null) overlap = steps;
                else overlap.retainAll(steps);
            }

            int firstLineIdx = groupLines.get(0);
            int lastLineIdx = groupLines.get(groupLines.size() - 1);
            Integer limit = null;
            for (int idx = firstLineIdx + 1; idx < lastLineIdx; idx++) {
                int b = lines.get(idx).getInitialIndentBalance();
                limit = limit == null ? b : Math.min(limit, b);
            }
            if (limit != null) {
                int ceiling = limit - 1;
                overlap.removeIf(i -> i > ceiling);
            }
            log.debug("    Overlap: {}, Limit: {}", overlap, limit);

            int best;
            if (!overlap.isEmpty()) {
                best = Collections.min(overlap);
                log.debug("    Case 2: Best: {}", best);
            } else {
                best = Collections.min(balances);
                log.debug("    Case 3: Best: {}", best);
                for (int idx = firstLineIdx + 1; idx < lastLineIdx; idx++) {
                    if (!groupLines.contains(idx)) {
                        IndentLine between = lines.get(idx);
                        between.setInitialIndentBalance(between.getInitialIndentBalance() - 1);
                    }
                }
            }

            for (int idx : groupLines) {
                lines.get(idx).setInitialIndentBalance(best);
            }
            events.emit(ReflowEvent.at(ReflowEventCode.TEMPLATE_LINES_REVISED,
                    lines.get(firstLineIdx).closingTag(elements),
                    "template tags aligned to balance " + best, "lines=" + groupLines.size()));
        }
    }

    // Balances a lone tag could sit at by moving across the markers of the point before it,
    // in either direction.
    private static Set<Integer> balanceOptions(IndentLine line, List<ReflowElement> elements) {
        List<RawSegment> segs = elements.get(line.first().getIdx()).getSegments();
        Set<Integer> steps = new HashSet<>();

        int balance = line.getInitialIndentBalance();
        for (int i = segs.size() - 1; i >= 0; i--) {
            if (segs.get(i) instanceof Indent) balance -= ((Indent) segs.get(i)).getIndentVal();
            steps.add(balance);
        }
        balance = line.getInitialIndentBalance();
        for (RawSegment seg : segs) {
            if (seg instanceof Indent) balance += ((Indent) seg).getIndentVal();
            steps.add(balance);
        }
        return steps;
    }

    /** Comment-only lines take the balance of the next code line, or 0 at the end. */
    static void reviseCommentLines(List<IndentLine> lines, List<ReflowElement> elements, ReflowEventSink events) {
        List<Integer> commentLineBuffer = new ArrayList<>();
        for (int idx = 0; idx < lines.size(); idx++) {
            IndentLine line = lines.get(idx);
            if (line.isAllComments(elements)) {
                commentLineBuffer.add(idx);
                continue;
            }
            for (int commentIdx : commentLineBuffer) {
                log.debug("Comment only line: {}. Anchoring to {}", commentIdx, idx);
                anchorComment(lines.get(commentIdx), line.getInitialIndentBalance(), elements, events);
            }
            commentLineBuffer.clear();
        }
        for (int commentIdx : commentLineBuffer) {
            log.debug("Comment only line: {}. Anchoring to baseline", commentIdx);
            anchorComment(lines.get(commentIdx), 0, elements, events);
        }
    }

    private static void anchorComment(IndentLine line, int balance, List<ReflowElement> elements, ReflowEventSink events) {
        if (line.getInitialIndentBalance() == balance) return;
        line.setInitialIndentBalance(balance);
        List<ReflowBlock> blocks = line.blocks(elements);
        events.emit(ReflowEvent.at(ReflowEventCode.COMMENT_LINE_ANCHORED,
                blocks.isEmpty() ? null : blocks.get(0).getSegment(),
                "comment line anchored to balance " + balance, null));
    }

    // ------------------------------------------------------------
    // evaluation
    // ------------------------------------------------------------

    /**
     * Correct one line. Mutates {@code elements} and {@code forcedIndents}.
     */
    static List<LintFix> evaluateIndentPointBuffer(
            List<ReflowElement> elements,
            IndentLine line,
            String singleIndent,
            List<Integer> forcedIndents,
            ReflowEventSink events
    ) {
        log.debug("Evaluate line: {}. FI {}", line, forcedIndents);
        List<LintFix> fixes = new ArrayList<>();
        List<IndentPoint> indentPoints = line.getIndentPoints();
        IndentPoint first = line.first();
        IndentPoint last = line.last();
        int startingBalance = line.getInitialIndentBalance();

        String currentIndent;
        if (last.getLastLineBreakIdx() != null) {
            String indent = ((ReflowPoint) elements.get(last.getLastLineBreakIdx())).getIndent();
            currentIndent = indent == null ? "" : indent;
        } else if (elements.get(0) instanceof ReflowPoint) {
            currentIndent = elements.get(0).getRaw();
        } else {
            currentIndent = "";
        }

        String desiredStartingIndent = singleIndent.repeat(line.desiredIndentUnits(forcedIndents));
        ReflowPoint initialPoint = (ReflowPoint) elements.get(first.getIdx());
        int closingBalance = last.getClosingIndentBalance();

        if (!currentIndent.equals(desiredStartingIndent)) {
            RawSegment before = segmentAfter(elements, first.getIdx());
            log.debug("  Correcting indent @ {}. Existing indent: '{}' -> '{}'",
                    before, currentIndent, desiredStartingIndent);
            String description = "Expected indent of " + desiredStartingIndent.length() + " characters.";
            if (first.getIdx() == 0 && !first.isLineBreak()) {
                // Nothing precedes the first line: its leading whitespace goes, markers stay.
                List<RawSegment> kept = new ArrayList<>();
                for (RawSegment seg : initialPoint.getSegments()) {
                    if (seg.getKind() == SegmentKind.WHITESPACE) fixes.add(LintFix.delete(seg, description));
                    else kept.add(seg);
                }
                elements.set(0, new ReflowPoint(kept));
            } else {
                ReflowPoint.Result r = initialPoint.indentTo(
                        desiredStartingIndent, before, segmentBefore(elements, first.getIdx()), description);
                elements.set(first.getIdx(), r.getPoint());
                fixes.addAll(r.getFixes());
            }
            events.emit(ReflowEvent.at(ReflowEventCode.INDENT_CORRECTED, before,
                    "indent corrected", "'" + currentIndent + "' -> '" + desiredStartingIndent + "'"));
        }

        if (closingBalance > startingBalance) {
            // On the way up: is the closing balance an untaken indent from this same line?
            int closingTrough = last.getInitialIndentBalance()
                    + (last.getIndentTrough() != 0 ? last.getIndentTrough() : last.getIndentImpulse());
            if (last.getUntakenIndents().contains(closingTrough)) {
                IndentPoint target = null;
                for (IndentPoint ip : indentPoints) {
                    if (ip.getClosingIndentBalance() == closingTrough) {
                        target = ip;
                        break;
                    }
                }
                if (target == null) {
                    throw new IllegalStateException("No point on the line closes at balance "
                            + closingTrough + ": " + line);
                }
                String desiredIndent = singleIndent.repeat(Math.max(0,
                        target.getClosingIndentBalance() - target.getUntakenIndents().size()));
                RawSegment before = segmentAfter(elements, target.getIdx());
                log.debug("  Detected missing +ve line break @ {}. Indenting to '{}'", before, desiredIndent);
                ReflowPoint.Result r = ((ReflowPoint) elements.get(target.getIdx())).indentTo(
                        desiredIndent, before, segmentBefore(elements, target.getIdx()),
                        "Expected line break and indent of " + desiredIndent.length() + " characters.");
                elements.set(target.getIdx(), r.getPoint());
                fixes.addAll(r.getFixes());
                forcedIndents.add(closingBalance);
                events.emit(ReflowEvent.at(ReflowEventCode.MISSING_BREAK_ON_INDENT, before,
                        "line break inserted after indent", "balance=" + closingTrough));
            }
        } else if (closingBalance < startingBalance) {
            // On the way down: dedents on this line whose indent was taken need a break.
            for (IndentPoint ip : indentPoints.subList(0, indentPoints.size() - 1)) {
                if (ip.isLineBreak() || ip.getIndentImpulse() >= 0) continue;
                if (ip.getUntakenIndents().contains(ip.getInitialIndentBalance())
                        && !forcedIndents.contains(ip.getInitialIndentBalance())) {
                    continue;
                }
                String desiredIndent = singleIndent.repeat(Math.max(0,
                        ip.getClosingIndentBalance() - ip.getUntakenIndents().size() + forcedIndents.size()));
                RawSegment before = segmentAfter(elements, ip.getIdx());
                log.debug("  Detected missing -ve line break @ {}. Indenting to '{}'", before, desiredIndent);
                ReflowPoint.Result r = ((ReflowPoint) elements.get(ip.getIdx())).indentTo(
                        desiredIndent, before, segmentBefore(elements, ip.getIdx()),
                        "Expected line break and indent of " + desiredIndent.length() + " characters.");
                elements.set(ip.getIdx(), r.getPoint());
                fixes.addAll(r.getFixes());
                events.emit(ReflowEvent.at(ReflowEventCode.MISSING_BREAK_ON_DEDENT, before,
                        "line break inserted before dedent", "balance=" + ip.getInitialIndentBalance()));
            }
        }

        forcedIndents.removeIf(i -> i > closingBalance);
        return fixes;
    }

    private static RawSegment segmentAfter(List<ReflowElement> elements, int idx) {
        if (idx + 1 >= elements.size()) return null;
        List<RawSegment> segs = elements.get(idx + 1).getSegments();
        return segs.isEmpty() ? null : segs.get(0);
    }

    private static RawSegment segmentBefore(List<ReflowElement> elements, int idx) {
        if (idx == 0) return null;
        List<RawSegment> segs = elements.get(idx - 1).getSegments();
        return segs.isEmpty() ? null : segs.get(segs.size() - 1);
    }
}
