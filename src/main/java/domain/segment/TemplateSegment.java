package domain.segment;

/**
 * Placeholder for templated source (a tag, a loop marker or a templated literal).
 *
 * <p>Tags belonging to one template block (e.g. the {@code for} and {@code endfor} of a
 * loop) share a {@code blockUuid}.</p>
 */
public final class TemplateSegment extends RawSegment {

    public static final String BLOCK_LITERAL = "literal";
    public static final String BLOCK_START = "block_start";
    public static final String BLOCK_MID = "block_mid";
    public static final String BLOCK_END = "block_end";

    private final String sourceStr;
    private final String blockType;
    private final String blockUuid;

    public TemplateSegment(SegmentKind kind, String sourceStr, String blockType, String blockUuid, PositionMarker positionMarker) {
        super(kind, "", positionMarker);
        if (kind != SegmentKind.PLACEHOLDER && kind != SegmentKind.TEMPLATE_LOOP) {
            throw new IllegalArgumentException("not a template kind: " + kind);
        }
        this.sourceStr = sourceStr == null ? "" : sourceStr;
        this.blockType = blockType == null ? BLOCK_LITERAL : blockType;
        this.blockUuid = blockUuid;
    }

    public String getSourceStr() {
        return sourceStr;
    }

    public String getBlockType() {
        return blockType;
    }

    /** Correlates matched start/end tags; may be null for standalone literals. */
    public String getBlockUuid() {
        return blockUuid;
    }

    @Override
    public String getConsumedWhitespace() {
        if (!BLOCK_LITERAL.equals(blockType)) return null;
        return sourceStr;
    }

    @Override
    public RawSegment edit(String newRaw) {
        throw new UnsupportedOperationException("template segments cannot be edited");
    }

    @Override
    public RawSegment detachedCopy() {
        return new TemplateSegment(getKind(), sourceStr, blockType, blockUuid, null);
    }
}
