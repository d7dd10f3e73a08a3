package domain.reflow;

import java.util.Collections;
import java.util.List;

/**
 * Indent metadata of one point that is either a line break or carries indent markers.
 *
 * <p>An untaken indent is identified by the balance it rises <em>to</em>: a marker taking
 * the balance from 1 to 2 without a line break is untaken indent 2. The list only covers
 * untaken indents before this point.</p>
 */
final class IndentPoint {

    private final int idx;
    private final int indentImpulse;
    private final int indentTrough;
    private final int initialIndentBalance;
    private final Integer lastLineBreakIdx;
    private final boolean lineBreak;
    private final List<Integer> untakenIndents;

    IndentPoint(
            int idx,
            int indentImpulse,
            int indentTrough,
            int initialIndentBalance,
            Integer lastLineBreakIdx,
            boolean lineBreak,
            List<Integer> untakenIndents
    ) {
        this.idx = idx;
        this.indentImpulse = indentImpulse;
        this.indentTrough = indentTrough;
        this.initialIndentBalance = initialIndentBalance;
        this.lastLineBreakIdx = lastLineBreakIdx;
        this.lineBreak = lineBreak;
        this.untakenIndents = Collections.unmodifiableList(untakenIndents);
    }

    int getIdx() {
        return idx;
    }

    int getIndentImpulse() {
        return indentImpulse;
    }

    int getIndentTrough() {
        return indentTrough;
    }

    int getInitialIndentBalance() {
        return initialIndentBalance;
    }

    int getClosingIndentBalance() {
        return initialIndentBalance + indentImpulse;
    }

    /** Index of the previous line-break point, null on the first line. */
    Integer getLastLineBreakIdx() {
        return lastLineBreakIdx;
    }

    boolean isLineBreak() {
        return lineBreak;
    }

    List<Integer> getUntakenIndents() {
        return untakenIndents;
    }

    @Override
    public String toString() {
        return "IndentPoint{idx=" + idx
                + ", impulse=" + indentImpulse
                + ", trough=" + indentTrough
                + ", balance=" + initialIndentBalance
                + ", lastBreak=" + lastLineBreakIdx
                + ", break=" + lineBreak
                + ", untaken=" + untakenIndents + "}";
    }
}
