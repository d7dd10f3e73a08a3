package domain.segment;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Leaf token.
 */
public class RawSegment extends Segment {

    private final SegmentKind kind;
    private final String raw;
    private final PositionMarker positionMarker;

    public RawSegment(SegmentKind kind, String type, String raw, PositionMarker positionMarker, Set<String> extraTypes) {
        super(type == null ? kind.typeName() : type, withKind(kind, extraTypes));
        this.kind = kind;
        this.raw = raw == null ? "" : raw;
        this.positionMarker = positionMarker;
    }

    public RawSegment(SegmentKind kind, String raw, PositionMarker positionMarker) {
        this(kind, null, raw, positionMarker, null);
    }

    private static Set<String> withKind(SegmentKind kind, Set<String> extraTypes) {
        if (kind == null) throw new IllegalArgumentException("kind is null");
        Set<String> all = new LinkedHashSet<>();
        all.add(kind.typeName());
        if (extraTypes != null) all.addAll(extraTypes);
        return all;
    }

    /** New whitespace token. It has no position because it does not exist in the source yet. */
    public static RawSegment whitespace(String raw) {
        return new RawSegment(SegmentKind.WHITESPACE, raw, null);
    }

    public static RawSegment newline() {
        return new RawSegment(SegmentKind.NEWLINE, "\n", null);
    }

    public SegmentKind getKind() {
        return kind;
    }

    @Override
    public String getRaw() {
        return raw;
    }

    @Override
    public List<RawSegment> getRawSegments() {
        return Collections.singletonList(this);
    }

    @Override
    public List<Segment> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public PositionMarker getPositionMarker() {
        return positionMarker;
    }

    @Override
    public boolean isCode() {
        return kind == SegmentKind.CODE;
    }

    /**
     * Copy with new text. The copy keeps type and position so that fixes reported on it
     * still point at the original location.
     */
    public RawSegment edit(String newRaw) {
        return new RawSegment(kind, getType(), newRaw, positionMarker, getClassTypes());
    }

    /** Copy without a position, for moving a token somewhere else. */
    public RawSegment detachedCopy() {
        return new RawSegment(kind, getType(), raw, null, getClassTypes());
    }

    /**
     * Whitespace this token stands for in the rendered output, or null.
     *
     * <p>Only templated literals can consume whitespace; ordinary tokens return null.</p>
     */
    public String getConsumedWhitespace() {
        return null;
    }
}
