package domain.reflow;

import domain.segment.RawSegment;
import domain.segment.Segment;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Depth lookup for the raw tokens of one tree.
 *
 * <p>Entries are added when edits synthesize new tokens, so that later blocks built from
 * them resolve spacing the same way as their neighbours. One map belongs to one file.</p>
 */
public final class DepthMap {

    private final Map<RawSegment, DepthInfo> depthInfo;

    private DepthMap(Map<RawSegment, DepthInfo> depthInfo) {
        this.depthInfo = depthInfo;
    }

    /** Efficient route: a single walk of the whole tree. */
    public static DepthMap fromParent(Segment root) {
        Map<RawSegment, DepthInfo> map = new IdentityHashMap<>();
        walk(root, new ArrayList<>(), map);
        return new DepthMap(map);
    }

    /** Slower route for a subset of raws: one path search per raw. */
    public static DepthMap fromRawsAndRoot(List<RawSegment> raws, Segment root) {
        Map<RawSegment, DepthInfo> map = new IdentityHashMap<>();
        for (RawSegment raw : raws) {
            if (raw == root) {
                map.put(raw, DepthInfo.fromStack(new ArrayList<>()));
                continue;
            }
            List<Segment> path = root.pathTo(raw);
            if (path.isEmpty()) {
                throw new IllegalArgumentException("Raw segment is not part of the root: " + raw);
            }
            map.put(raw, DepthInfo.fromStack(path));
        }
        return new DepthMap(map);
    }

    private static void walk(Segment node, List<Segment> stack, Map<RawSegment, DepthInfo> map) {
        if (node instanceof RawSegment) {
            map.put((RawSegment) node, DepthInfo.fromStack(stack));
            return;
        }
        stack.add(node);
        for (Segment child : node.getChildren()) {
            walk(child, stack, map);
        }
        stack.remove(stack.size() - 1);
    }

    public DepthInfo getDepthInfo(RawSegment raw) {
        DepthInfo info = depthInfo.get(raw);
        if (info == null) throw new IllegalArgumentException("No depth info for " + raw);
        return info;
    }

    public boolean contains(RawSegment raw) {
        return depthInfo.containsKey(raw);
    }

    /** Register {@code newRaw} at the depth of {@code anchor}, minus {@code trim} levels. */
    public void copyDepthInfo(RawSegment anchor, RawSegment newRaw, int trim) {
        depthInfo.put(newRaw, getDepthInfo(anchor).trim(trim));
    }

    public void copyDepthInfo(RawSegment anchor, RawSegment newRaw) {
        copyDepthInfo(anchor, newRaw, 0);
    }
}
