package domain.reflow;

import domain.segment.Segment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Structural position of a token: the chain of ancestors from the root down to its parent.
 *
 * <p>Ancestors are compared by identity. Two equal-looking subtrees at different places in
 * the file never count as a shared parent.</p>
 */
public final class DepthInfo {

    private final int stackDepth;
    private final List<Segment> stack;
    private final Set<Segment> stackSet;
    private final List<Set<String>> stackClassTypes;

    private DepthInfo(List<Segment> stack) {
        this.stackDepth = stack.size();
        this.stack = Collections.unmodifiableList(stack);
        Set<Segment> set = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Set<String>> types = new ArrayList<>(stack.size());
        for (Segment s : stack) {
            set.add(s);
            types.add(s.getClassTypes());
        }
        this.stackSet = Collections.unmodifiableSet(set);
        this.stackClassTypes = Collections.unmodifiableList(types);
    }

    /** Depth info from an ancestor chain, outermost first. */
    public static DepthInfo fromStack(List<Segment> ancestors) {
        return new DepthInfo(new ArrayList<>(ancestors));
    }

    /**
     * Copy without the innermost {@code amount} levels.
     *
     * <p>Used when a token is replaced together with wrapper segments that no longer exist.</p>
     */
    public DepthInfo trim(int amount) {
        if (amount <= 0) return this;
        if (amount > stackDepth) {
            throw new IllegalArgumentException("Cannot trim " + amount + " levels from depth " + stackDepth);
        }
        return new DepthInfo(new ArrayList<>(stack.subList(0, stackDepth - amount)));
    }

    /**
     * Index (into this stack) of the deepest ancestor shared with {@code other}, or -1.
     */
    public int deepestCommonLevel(DepthInfo other) {
        if (other == null) return -1;
        for (int i = stackDepth - 1; i >= 0; i--) {
            if (other.stackSet.contains(stack.get(i))) return i;
        }
        return -1;
    }

    /** True when any ancestor has one of {@code types}. */
    public boolean isWithinAny(Set<String> types) {
        if (types == null || types.isEmpty()) return false;
        for (Set<String> level : stackClassTypes) {
            for (String t : level) {
                if (types.contains(t)) return true;
            }
        }
        return false;
    }

    public int getStackDepth() {
        return stackDepth;
    }

    /** Ancestors, outermost first. */
    public List<Segment> getStack() {
        return stack;
    }

    public List<Set<String>> getStackClassTypes() {
        return stackClassTypes;
    }
}
