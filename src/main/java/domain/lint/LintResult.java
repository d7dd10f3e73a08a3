package domain.lint;

import domain.segment.PositionMarker;
import domain.segment.Segment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A user-facing report entry: where the problem is and which fixes resolve it.
 */
public final class LintResult {

    private final Segment anchor;
    private final List<LintFix> fixes;
    private final String description;

    public LintResult(Segment anchor, List<LintFix> fixes, String description) {
        this.anchor = anchor;
        this.fixes = fixes == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(fixes));
        this.description = description == null ? "" : description;
    }

    public Segment getAnchor() {
        return anchor;
    }

    public List<LintFix> getFixes() {
        return fixes;
    }

    public String getDescription() {
        return description;
    }

    public int getLineNo() {
        PositionMarker pm = anchor == null ? null : anchor.getPositionMarker();
        return pm == null ? 0 : pm.getLineNo();
    }

    public int getLinePos() {
        PositionMarker pm = anchor == null ? null : anchor.getPositionMarker();
        return pm == null ? 0 : pm.getLinePos();
    }
}
