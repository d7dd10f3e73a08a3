package domain.segment;

/**
 * Source position of a token in the original file.
 *
 * <p>Tokens synthesized by fixes carry no marker. Only tokens with a marker exist in the
 * source, which is what report anchoring relies on.</p>
 */
public final class PositionMarker implements Comparable<PositionMarker> {

    private final int lineNo;
    private final int linePos;
    private final int offset;

    public PositionMarker(int lineNo, int linePos, int offset) {
        this.lineNo = lineNo;
        this.linePos = linePos;
        this.offset = offset;
    }

    public int getLineNo() {
        return lineNo;
    }

    public int getLinePos() {
        return linePos;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public int compareTo(PositionMarker o) {
        if (lineNo != o.lineNo) return Integer.compare(lineNo, o.lineNo);
        return Integer.compare(linePos, o.linePos);
    }

    @Override
    public String toString() {
        return "L" + lineNo + ":P" + linePos;
    }
}
