package domain.reflow;

import domain.segment.RawSegment;
import domain.segment.SegmentKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The indent points of one line: the break that opens it, any marker points on it, and
 * the break that closes it.
 *
 * <p>The initial balance is mutable so that template and comment lines can be revised
 * after all lines have been mapped.</p>
 */
final class IndentLine {

    private static final Logger log = LoggerFactory.getLogger(IndentLine.class);

    private int initialIndentBalance;
    private final List<IndentPoint> indentPoints;

    IndentLine(int initialIndentBalance, List<IndentPoint> indentPoints) {
        if (indentPoints == null || indentPoints.isEmpty()) {
            throw new IllegalArgumentException("IndentLine needs at least one point");
        }
        this.initialIndentBalance = initialIndentBalance;
        this.indentPoints = Collections.unmodifiableList(new ArrayList<>(indentPoints));
    }

    /** The first line of a file starts at 0; any other line at the balance after its opening break. */
    static IndentLine fromPoints(List<IndentPoint> points) {
        IndentPoint last = points.get(points.size() - 1);
        int startingBalance = last.getLastLineBreakIdx() != null ? points.get(0).getClosingIndentBalance() : 0;
        return new IndentLine(startingBalance, points);
    }

    int getInitialIndentBalance() {
        return initialIndentBalance;
    }

    void setInitialIndentBalance(int initialIndentBalance) {
        this.initialIndentBalance = initialIndentBalance;
    }

    List<IndentPoint> getIndentPoints() {
        return indentPoints;
    }

    IndentPoint first() {
        return indentPoints.get(0);
    }

    IndentPoint last() {
        return indentPoints.get(indentPoints.size() - 1);
    }

    /** Blocks on this line, in order. */
    List<ReflowBlock> blocks(List<ReflowElement> elements) {
        int from = last().getLastLineBreakIdx() == null ? 0 : first().getIdx();
        int to = Math.min(last().getIdx(), elements.size());
        List<ReflowBlock> out = new ArrayList<>();
        for (ReflowElement e : elements.subList(from, to)) {
            if (e instanceof ReflowBlock) out.add((ReflowBlock) e);
        }
        return out;
    }

    boolean isAllComments(List<ReflowElement> elements) {
        List<ReflowBlock> blocks = blocks(elements);
        if (blocks.isEmpty()) return false;
        for (ReflowBlock b : blocks) {
            if (b.getSegment().getKind() != SegmentKind.COMMENT) return false;
        }
        return true;
    }

    boolean isAllTemplates(List<ReflowElement> elements) {
        List<ReflowBlock> blocks = blocks(elements);
        if (blocks.isEmpty()) return false;
        for (ReflowBlock b : blocks) {
            SegmentKind k = b.getSegment().getKind();
            if (k != SegmentKind.PLACEHOLDER && k != SegmentKind.TEMPLATE_LOOP) return false;
        }
        return true;
    }

    /**
     * Indent units this line should start at.
     *
     * <p>Untaken indents lower the indent since they were never broken. When the opening
     * point dips first, only the untaken indents that survive the dip count. Forced indents
     * (breaks inserted on earlier lines) raise it. Never below zero.</p>
     */
    int desiredIndentUnits(List<Integer> forcedIndents) {
        IndentPoint first = first();
        List<Integer> relevantUntaken;
        if (first.getIndentTrough() != 0) {
            int ceiling = initialIndentBalance - (first.getIndentImpulse() - first.getIndentTrough());
            relevantUntaken = new ArrayList<>();
            for (Integer i : first.getUntakenIndents()) {
                if (i <= ceiling) relevantUntaken.add(i);
            }
        } else {
            relevantUntaken = first.getUntakenIndents();
        }
        int desired = initialIndentBalance - relevantUntaken.size() + forcedIndents.size();
        log.debug("Desired indent: IB={} RUI={} UIL={} iII={} iIT={} = {}",
                initialIndentBalance, relevantUntaken, first.getUntakenIndents(),
                first.getIndentImpulse(), first.getIndentTrough(), desired);
        return Math.max(0, desired);
    }

    /** Template tag ending this line, when the line is a lone tag. */
    RawSegment closingTag(List<ReflowElement> elements) {
        int tagIdx = last().getIdx() - 1;
        if (tagIdx < 0 || !(elements.get(tagIdx) instanceof ReflowBlock)) return null;
        return ((ReflowBlock) elements.get(tagIdx)).getSegment();
    }

    @Override
    public String toString() {
        return "IndentLine{balance=" + initialIndentBalance + ", points=" + indentPoints + "}";
    }
}
