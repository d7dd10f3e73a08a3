package domain.reflow;

import domain.segment.RawSegment;
import domain.segment.SegmentKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Reflow element holding exactly one content token and the spacing it asks for.
 */
public final class ReflowBlock extends ReflowElement {

    private final Spacing spacingBefore;
    private final Spacing spacingAfter;
    private final LinePosition linePosition;
    private final DepthInfo depthInfo;
    // spacing_within of each ancestor level, aligned with depthInfo; null where unset
    private final List<Spacing> stackSpacingWithin;

    private ReflowBlock(
            RawSegment segment,
            Spacing spacingBefore,
            Spacing spacingAfter,
            LinePosition linePosition,
            DepthInfo depthInfo,
            List<Spacing> stackSpacingWithin
    ) {
        super(Collections.singletonList(segment));
        this.spacingBefore = spacingBefore;
        this.spacingAfter = spacingAfter;
        this.linePosition = linePosition;
        this.depthInfo = depthInfo;
        this.stackSpacingWithin = Collections.unmodifiableList(stackSpacingWithin);
    }

    /**
     * Build a block, resolving its layout from the config table.
     *
     * @throws IllegalArgumentException unless exactly one segment is given
     */
    public static ReflowBlock fromConfig(List<RawSegment> segments, ReflowConfig config, DepthInfo depthInfo) {
        if (segments == null || segments.size() != 1) {
            throw new IllegalArgumentException("ReflowBlock requires exactly one segment, got "
                    + (segments == null ? 0 : segments.size()));
        }
        if (config == null) throw new IllegalArgumentException("config is null");
        if (depthInfo == null) throw new IllegalArgumentException("depthInfo is null");

        RawSegment seg = segments.get(0);
        TypeLayoutConfig cfg = config.getBlockConfig(seg.getType(), seg.getClassTypes());

        List<Spacing> within = new ArrayList<>(depthInfo.getStackDepth());
        for (Set<String> levelTypes : depthInfo.getStackClassTypes()) {
            within.add(config.getSpacingWithin(levelTypes));
        }
        return new ReflowBlock(seg, cfg.getSpacingBefore(), cfg.getSpacingAfter(), cfg.getLinePosition(), depthInfo, within);
    }

    public RawSegment getSegment() {
        return getSegments().get(0);
    }

    public Spacing getSpacingBefore() {
        return spacingBefore;
    }

    public Spacing getSpacingAfter() {
        return spacingAfter;
    }

    public LinePosition getLinePosition() {
        return linePosition;
    }

    public DepthInfo getDepthInfo() {
        return depthInfo;
    }

    /** spacing_within configured at ancestor {@code level}, or null. */
    public Spacing getSpacingWithinAt(int level) {
        if (level < 0 || level >= stackSpacingWithin.size()) return null;
        return stackSpacingWithin.get(level);
    }

    public boolean isEndOfFile() {
        return getSegment().getKind() == SegmentKind.END_OF_FILE;
    }
}
