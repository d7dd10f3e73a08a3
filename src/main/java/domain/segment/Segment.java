package domain.segment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A node of the parsed token tree.
 *
 * <p>Segments are compared by identity. Two tokens with the same text at different places
 * in the file are different segments, and the reflow code locates tokens with
 * {@code ==}, never {@code equals}.</p>
 */
public abstract class Segment {

    private final String type;
    private final Set<String> classTypes;

    protected Segment(String type, Set<String> extraTypes) {
        if (type == null || type.isBlank()) throw new IllegalArgumentException("type is blank");
        this.type = type;
        Set<String> all = new LinkedHashSet<>();
        all.add(type);
        if (extraTypes != null) all.addAll(extraTypes);
        this.classTypes = Collections.unmodifiableSet(all);
    }

    public String getType() {
        return type;
    }

    public Set<String> getClassTypes() {
        return classTypes;
    }

    public boolean isType(String... types) {
        for (String t : types) {
            if (classTypes.contains(t)) return true;
        }
        return false;
    }

    public abstract String getRaw();

    /** Leaves of this subtree in source order. A raw segment returns itself. */
    public abstract List<RawSegment> getRawSegments();

    public abstract List<Segment> getChildren();

    /** Marker of the first positioned leaf, or null when nothing in the subtree has one. */
    public abstract PositionMarker getPositionMarker();

    public abstract boolean isCode();

    /**
     * Path of ancestors from this segment (inclusive) down to the parent of {@code target}.
     *
     * <p>Empty when {@code target} is this segment or is not found below it.</p>
     */
    public List<Segment> pathTo(Segment target) {
        List<Segment> path = new ArrayList<>();
        if (target == this) return path;
        if (collectPath(this, target, path)) return path;
        return new ArrayList<>();
    }

    private static boolean collectPath(Segment node, Segment target, List<Segment> path) {
        path.add(node);
        for (Segment child : node.getChildren()) {
            if (child == target) return true;
            if (collectPath(child, target, path)) return true;
        }
        path.remove(path.size() - 1);
        return false;
    }

    @Override
    public String toString() {
        PositionMarker pm = getPositionMarker();
        return getClass().getSimpleName() + "(" + type + ", " + quote(getRaw()) + (pm == null ? "" : " @" + pm) + ")";
    }

    private static String quote(String s) {
        return "'" + s.replace("\n", "\\n").replace("\t", "\\t") + "'";
    }
}
