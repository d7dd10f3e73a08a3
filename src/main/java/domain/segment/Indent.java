package domain.segment;

import java.util.Set;

/**
 * Zero-width indent (+1) or dedent (-1) marker injected by the dialect layer.
 */
public final class Indent extends RawSegment {

    private final int indentVal;

    public Indent(int indentVal, PositionMarker positionMarker) {
        super(SegmentKind.INDENT, indentVal < 0 ? "dedent" : "indent", "", positionMarker,
                indentVal < 0 ? Set.of("indent", "dedent") : Set.of("indent"));
        if (indentVal != 1 && indentVal != -1) {
            throw new IllegalArgumentException("indentVal must be +1 or -1: " + indentVal);
        }
        this.indentVal = indentVal;
    }

    public int getIndentVal() {
        return indentVal;
    }

    @Override
    public RawSegment edit(String newRaw) {
        throw new UnsupportedOperationException("indent markers have no text");
    }

    @Override
    public RawSegment detachedCopy() {
        return new Indent(indentVal, null);
    }

    @Override
    public String toString() {
        return indentVal > 0 ? "Indent(+1)" : "Dedent(-1)";
    }
}
