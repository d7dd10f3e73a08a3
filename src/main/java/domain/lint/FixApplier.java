package domain.lint;

import domain.segment.RawSegment;
import domain.segment.Segment;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies fixes to a flat list of raw tokens.
 *
 * <p>Fixes are applied in order and located by anchor identity. A fix may anchor on a
 * token introduced by an earlier fix in the same list. This is how callers render the
 * result of a reflow without rebuilding the tree.</p>
 */
public final class FixApplier {

    private FixApplier() {
    }

    public static List<RawSegment> apply(List<RawSegment> raws, List<LintFix> fixes) {
        if (raws == null) throw new IllegalArgumentException("raws is null");
        List<RawSegment> out = new ArrayList<>(raws);
        if (fixes == null) return out;

        for (LintFix fix : fixes) {
            List<RawSegment> anchorRaws = fix.getAnchor().getRawSegments();
            int first = indexOf(out, anchorRaws.get(0));
            int last = indexOf(out, anchorRaws.get(anchorRaws.size() - 1));
            if (first < 0 || last < first) {
                throw new IllegalStateException("Fix anchor not found: " + fix);
            }
            List<RawSegment> editRaws = flatten(fix.getEdit());
            switch (fix.getEditType()) {
                case DELETE -> out.subList(first, last + 1).clear();
                case REPLACE -> {
                    out.subList(first, last + 1).clear();
                    out.addAll(first, editRaws);
                }
                case CREATE_BEFORE -> out.addAll(first, editRaws);
                case CREATE_AFTER -> out.addAll(last + 1, editRaws);
            }
        }
        return out;
    }

    public static String render(List<RawSegment> raws) {
        StringBuilder sb = new StringBuilder();
        for (RawSegment r : raws) sb.append(r.getRaw());
        return sb.toString();
    }

    private static List<RawSegment> flatten(List<Segment> segments) {
        List<RawSegment> out = new ArrayList<>();
        for (Segment s : segments) out.addAll(s.getRawSegments());
        return out;
    }

    private static int indexOf(List<RawSegment> raws, RawSegment target) {
        for (int i = 0; i < raws.size(); i++) {
            if (raws.get(i) == target) return i;
        }
        return -1;
    }
}
