package domain.segment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Non-leaf node of the tree (a statement, a clause, a bracketed expression...).
 */
public final class CompositeSegment extends Segment {

    private final List<Segment> children;

    public CompositeSegment(String type, List<? extends Segment> children) {
        this(type, children, null);
    }

    public CompositeSegment(String type, List<? extends Segment> children, Set<String> extraTypes) {
        super(type, extraTypes);
        if (children == null) throw new IllegalArgumentException("children is null");
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    @Override
    public String getRaw() {
        StringBuilder sb = new StringBuilder();
        for (Segment child : children) sb.append(child.getRaw());
        return sb.toString();
    }

    @Override
    public List<RawSegment> getRawSegments() {
        List<RawSegment> out = new ArrayList<>();
        for (Segment child : children) out.addAll(child.getRawSegments());
        return out;
    }

    @Override
    public List<Segment> getChildren() {
        return children;
    }

    @Override
    public PositionMarker getPositionMarker() {
        for (Segment child : children) {
            PositionMarker pm = child.getPositionMarker();
            if (pm != null) return pm;
        }
        return null;
    }

    @Override
    public boolean isCode() {
        for (Segment child : children) {
            if (child.isCode()) return true;
        }
        return false;
    }
}
