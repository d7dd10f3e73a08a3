package domain.reflow;

/**
 * Layout settings for one segment type. Null fields mean "not configured for this type".
 */
public final class TypeLayoutConfig {

    private final Spacing spacingBefore;
    private final Spacing spacingAfter;
    private final Spacing spacingWithin;
    private final LinePosition linePosition;

    public TypeLayoutConfig(Spacing spacingBefore, Spacing spacingAfter, Spacing spacingWithin, LinePosition linePosition) {
        this.spacingBefore = spacingBefore;
        this.spacingAfter = spacingAfter;
        this.spacingWithin = spacingWithin;
        this.linePosition = linePosition;
    }

    public static TypeLayoutConfig before(Spacing spacing) {
        return new TypeLayoutConfig(spacing, null, null, null);
    }

    public static TypeLayoutConfig after(Spacing spacing) {
        return new TypeLayoutConfig(null, spacing, null, null);
    }

    public static TypeLayoutConfig within(Spacing spacing) {
        return new TypeLayoutConfig(null, null, spacing, null);
    }

    public static TypeLayoutConfig position(LinePosition linePosition) {
        return new TypeLayoutConfig(null, null, null, linePosition);
    }

    /** Settings of {@code other} win where both are set. */
    public TypeLayoutConfig merge(TypeLayoutConfig other) {
        if (other == null) return this;
        return new TypeLayoutConfig(
                other.spacingBefore != null ? other.spacingBefore : spacingBefore,
                other.spacingAfter != null ? other.spacingAfter : spacingAfter,
                other.spacingWithin != null ? other.spacingWithin : spacingWithin,
                other.linePosition != null ? other.linePosition : linePosition
        );
    }

    public Spacing getSpacingBefore() {
        return spacingBefore;
    }

    public Spacing getSpacingAfter() {
        return spacingAfter;
    }

    public Spacing getSpacingWithin() {
        return spacingWithin;
    }

    public LinePosition getLinePosition() {
        return linePosition;
    }
}
