package domain.reflow;

import domain.segment.RawSegment;
import domain.segment.SegmentKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Common base of blocks and points. Immutable.
 */
public abstract class ReflowElement {

    private final List<RawSegment> segments;

    protected ReflowElement(List<RawSegment> segments) {
        this.segments = segments == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(segments));
    }

    public List<RawSegment> getSegments() {
        return segments;
    }

    public String getRaw() {
        StringBuilder sb = new StringBuilder();
        for (RawSegment s : segments) sb.append(s.getRaw());
        return sb.toString();
    }

    public Set<String> getClassTypes() {
        Set<String> out = new LinkedHashSet<>();
        for (RawSegment s : segments) out.addAll(s.getClassTypes());
        return out;
    }

    public int getNumNewlines() {
        int n = 0;
        for (RawSegment s : segments) {
            if (s.getKind() == SegmentKind.NEWLINE) n++;
        }
        return n;
    }

    public boolean containsSegment(RawSegment target) {
        for (RawSegment s : segments) {
            if (s == target) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + segments;
    }
}
