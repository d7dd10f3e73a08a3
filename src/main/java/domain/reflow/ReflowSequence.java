package domain.reflow;

import domain.lint.LintFix;
import domain.lint.LintResult;
import domain.model.ReflowEvent;
import domain.model.ReflowEventCode;
import domain.model.ReflowEventSink;
import domain.segment.PositionMarker;
import domain.segment.RawSegment;
import domain.segment.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Alternating sequence of {@link ReflowPoint} and {@link ReflowBlock} plus the fixes needed
 * to produce it from the original tree.
 *
 * <p>This is the main entry point of the reflow engine. Sequences are immutable: every
 * operation returns a new sequence whose fix list extends this one, so operations can be
 * chained and the fixes collected at the end:</p>
 *
 * <pre>{@code
 * List<LintFix> fixes = ReflowSequence.fromRoot(root, config)
 *         .reindent()
 *         .getFixes();
 * }</pre>
 */
public final class ReflowSequence {

    private static final Logger log = LoggerFactory.getLogger(ReflowSequence.class);

    private final List<ReflowElement> elements;
    private final Segment rootSegment;
    private final ReflowConfig reflowConfig;
    private final DepthMap depthMap;
    private final List<LintFix> embodiedFixes;
    private final ReflowEventSink eventSink;

    ReflowSequence(
            List<ReflowElement> elements,
            Segment rootSegment,
            ReflowConfig reflowConfig,
            DepthMap depthMap,
            List<LintFix> embodiedFixes,
            ReflowEventSink eventSink
    ) {
        validateReflowSequence(elements);
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.rootSegment = rootSegment;
        this.reflowConfig = reflowConfig;
        this.depthMap = depthMap;
        this.embodiedFixes = Collections.unmodifiableList(new ArrayList<>(
                embodiedFixes == null ? Collections.emptyList() : embodiedFixes));
        this.eventSink = eventSink == null ? ReflowEventSink.none() : eventSink;
    }

    // ------------------------------------------------------------
    // construction
    // ------------------------------------------------------------

    /**
     * Sequence from a run of raw segments.
     *
     * <p>Without a depth map one is derived from {@code root} by a path search per segment.
     * Callers that hold a better one should pass it in.</p>
     */
    public static ReflowSequence fromRawSegments(List<RawSegment> segments, Segment root, ReflowConfig config) {
        return fromRawSegments(segments, root, config, DepthMap.fromRawsAndRoot(segments, root));
    }

    public static ReflowSequence fromRawSegments(
            List<RawSegment> segments, Segment root, ReflowConfig config, DepthMap depthMap) {
        if (config == null) throw new IllegalArgumentException("config is null");
        return new ReflowSequence(
                elementsFromRawSegments(segments, config, depthMap),
                root, config, depthMap, null, null
        );
    }

    /** Sequence covering the whole tree. */
    public static ReflowSequence fromRoot(Segment root, ReflowConfig config) {
        return fromRawSegments(root.getRawSegments(), root, config, DepthMap.fromParent(root));
    }

    /**
     * Sequence around {@code target}, expanded to the nearest code token on the chosen
     * side(s) so that local edits see the spacing around them.
     *
     * <p>Comments between the target and that code token are swallowed. Expanding after
     * the target captures one more token past the code token.</p>
     */
    public static ReflowSequence fromAroundTarget(Segment target, Segment root, ReflowConfig config, Sides sides) {
        List<RawSegment> allRaws = root.getRawSegments();
        List<RawSegment> targetRaws = target.getRawSegments();
        if (targetRaws.isEmpty()) throw new IllegalArgumentException("target has no raw segments: " + target);

        int preIdx = indexOf(allRaws, targetRaws.get(0));
        int postIdx = indexOf(allRaws, targetRaws.get(targetRaws.size() - 1)) + 1;
        if (preIdx < 0 || postIdx <= 0) throw new IllegalArgumentException("target is not part of root: " + target);
        int initialPre = preIdx;
        int initialPost = postIdx;

        Sides side = sides == null ? Sides.BOTH : sides;
        if (side == Sides.BOTH || side == Sides.BEFORE) {
            preIdx--;
            while (preIdx > 0 && !allRaws.get(preIdx).isCode()) preIdx--;
            preIdx = Math.max(0, preIdx);
        }
        if (side == Sides.BOTH || side == Sides.AFTER) {
            while (postIdx < allRaws.size() && !allRaws.get(postIdx).isCode()) postIdx++;
            postIdx = Math.min(allRaws.size(), postIdx + 1);
        }

        List<RawSegment> segments = new ArrayList<>(allRaws.subList(preIdx, postIdx));
        if (log.isDebugEnabled()) {
            log.debug("fromAroundTarget idx=({}, {}) slice={}:{} raw={}",
                    initialPre, initialPost, preIdx, postIdx, render(segments));
        }
        return fromRawSegments(segments, root, config);
    }

    /** Same sequence reporting diagnostics to {@code sink}. */
    public ReflowSequence withEventSink(ReflowEventSink sink) {
        return new ReflowSequence(elements, rootSegment, reflowConfig, depthMap, embodiedFixes, sink);
    }

    static List<ReflowElement> elementsFromRawSegments(
            List<RawSegment> segments, ReflowConfig config, DepthMap depthMap) {
        List<ReflowElement> elemBuff = new ArrayList<>();
        List<RawSegment> segBuff = new ArrayList<>();
        for (RawSegment seg : segments) {
            // end_of_file is a block, which lets the end of the file be evaluated like any other point
            if (ReflowPoint.isSpacing(seg)) {
                segBuff.add(seg);
                continue;
            }
            if (!elemBuff.isEmpty() || !segBuff.isEmpty()) {
                // The previous element was a block (or nothing). The point may be empty.
                elemBuff.add(new ReflowPoint(segBuff));
            }
            elemBuff.add(ReflowBlock.fromConfig(List.of(seg), config, depthMap.getDepthInfo(seg)));
            segBuff = new ArrayList<>();
        }
        if (!segBuff.isEmpty()) {
            elemBuff.add(new ReflowPoint(segBuff));
        }
        return elemBuff;
    }

    private static void validateReflowSequence(List<ReflowElement> elements) {
        if (elements == null || elements.isEmpty()) {
            throw new IllegalArgumentException("ReflowSequence has empty elements.");
        }
        Class<?> evenType = elements.get(0).getClass();
        Class<?> oddType = evenType == ReflowBlock.class ? ReflowPoint.class : ReflowBlock.class;
        for (int i = 0; i < elements.size(); i++) {
            Class<?> expected = i % 2 == 0 ? evenType : oddType;
            if (elements.get(i).getClass() != expected) {
                for (ReflowElement e : elements) log.error("   - {}", e);
                throw new IllegalArgumentException("ReflowSequence does not alternate: element " + i
                        + " is " + elements.get(i).getClass().getSimpleName()
                        + ", expected " + expected.getSimpleName());
            }
        }
    }

    // ------------------------------------------------------------
    // accessors
    // ------------------------------------------------------------

    public List<ReflowElement> getElements() {
        return elements;
    }

    public List<LintFix> getFixes() {
        return embodiedFixes;
    }

    public Segment getRootSegment() {
        return rootSegment;
    }

    public ReflowConfig getReflowConfig() {
        return reflowConfig;
    }

    public DepthMap getDepthMap() {
        return depthMap;
    }

    public String getRaw() {
        StringBuilder sb = new StringBuilder();
        for (ReflowElement e : elements) sb.append(e.getRaw());
        return sb.toString();
    }

    public List<RawSegment> getRawSegments() {
        List<RawSegment> out = new ArrayList<>();
        for (ReflowElement e : elements) out.addAll(e.getSegments());
        return out;
    }

    /**
     * One report entry per fix.
     *
     * <p>For creations after a token (and replacements that keep the anchor's text as a
     * prefix) the reported location is moved forward to the next token that exists in the
     * source, so it points between the two tokens rather than at the start of the first.</p>
     */
    public List<LintResult> getResults() {
        List<LintResult> results = new ArrayList<>(embodiedFixes.size());
        List<RawSegment> segments = null;
        for (LintFix fix : embodiedFixes) {
            Segment anchor = fix.getAnchor();
            boolean huntForward = fix.getEditType() == LintFix.EditType.CREATE_AFTER
                    || (fix.getEditType() == LintFix.EditType.REPLACE
                    && fix.getEditRaw().startsWith(fix.getAnchor().getRaw()));
            if (huntForward) {
                if (segments == null) segments = getRawSegments();
                List<RawSegment> anchorRaws = fix.getAnchor().getRawSegments();
                int idx = anchorRaws.isEmpty() ? -1 : indexOf(segments, anchorRaws.get(anchorRaws.size() - 1));
                if (idx < 0) {
                    // The anchor was replaced or removed itself, so it is part of the problem.
                    eventSink.emit(ReflowEvent.at(ReflowEventCode.ANCHOR_NOT_FOUND, fix.getAnchor(),
                            "fix anchor not in sequence; reporting on the anchor", fix.getEditType().name()));
                } else {
                    for (RawSegment seg : segments.subList(idx + 1, segments.size())) {
                        if (seg.getPositionMarker() != null) {
                            anchor = seg;
                            break;
                        }
                    }
                }
            }
            results.add(new LintResult(anchor, List.of(fix), fix.getDescription()));
        }
        return results;
    }

    /**
     * Fixes before, within and after {@code target}, by source position of their anchors.
     * Fixes anchored on unpositioned segments count as within.
     */
    public PartitionedFixes getPartitionedFixes(Segment target) {
        List<RawSegment> targetRaws = target.getRawSegments();
        PositionMarker first = targetRaws.isEmpty() ? null : targetRaws.get(0).getPositionMarker();
        PositionMarker last = targetRaws.isEmpty() ? null : targetRaws.get(targetRaws.size() - 1).getPositionMarker();
        if (first == null || last == null) throw new IllegalArgumentException("target has no position: " + target);

        List<LintFix> pre = new ArrayList<>();
        List<LintFix> mid = new ArrayList<>();
        List<LintFix> post = new ArrayList<>();
        for (LintFix fix : embodiedFixes) {
            PositionMarker pm = fix.getAnchor().getPositionMarker();
            if (pm != null && (pm.compareTo(first) < 0
                    || (fix.getEditType() == LintFix.EditType.CREATE_BEFORE && pm.compareTo(first) == 0))) {
                pre.add(fix);
            } else if (pm != null && (pm.compareTo(last) > 0
                    || (fix.getEditType() == LintFix.EditType.CREATE_AFTER && pm.compareTo(last) == 0))) {
                post.add(fix);
            } else {
                mid.add(fix);
            }
        }
        return new PartitionedFixes(pre, mid, post);
    }

    // ------------------------------------------------------------
    // mutators
    // ------------------------------------------------------------

    private int findElementIdxWith(RawSegment target) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i).containsSegment(target)) return i;
        }
        throw new IllegalArgumentException("Target [" + target + "] not found in ReflowSequence.");
    }

    private ReflowSequence derive(List<ReflowElement> newElements, List<LintFix> newFixes) {
        List<LintFix> fixes = new ArrayList<>(embodiedFixes);
        fixes.addAll(newFixes);
        return new ReflowSequence(newElements, rootSegment, reflowConfig, depthMap, fixes, eventSink);
    }

    /** Remove the block holding {@code target}, merging the points either side of it. */
    public ReflowSequence without(RawSegment target) {
        int removalIdx = findElementIdxWith(target);
        if (removalIdx == 0 || removalIdx == elements.size() - 1) {
            throw new IllegalArgumentException("Unexpected removal at one end of a ReflowSequence: " + target);
        }
        if (elements.get(removalIdx) instanceof ReflowPoint) {
            throw new IllegalArgumentException("Cannot remove spacing from a ReflowSequence: " + target);
        }
        List<RawSegment> merged = new ArrayList<>(elements.get(removalIdx - 1).getSegments());
        merged.addAll(elements.get(removalIdx + 1).getSegments());

        List<ReflowElement> out = new ArrayList<>(elements.subList(0, removalIdx - 1));
        out.add(new ReflowPoint(merged));
        out.addAll(elements.subList(removalIdx + 2, elements.size()));
        return derive(out, List.of(LintFix.delete(target, "Remove " + target.getType() + ".")));
    }

    /**
     * Insert a content token next to the block holding {@code target}, with an empty point
     * between them. The new token takes the depth of its target, i.e. it becomes a sibling.
     */
    public ReflowSequence insert(RawSegment insertion, RawSegment target, InsertPosition position) {
        if (ReflowPoint.isSpacing(insertion)) {
            throw new IllegalArgumentException("ReflowSequence.insert() does not support direct insertion of "
                    + "spacing elements such as whitespace or newlines");
        }
        int targetIdx = findElementIdxWith(target);
        if (elements.get(targetIdx) instanceof ReflowPoint) {
            throw new IllegalArgumentException("Cannot insert relative to whitespace: " + target);
        }
        depthMap.copyDepthInfo(target, insertion);
        ReflowBlock newBlock = ReflowBlock.fromConfig(List.of(insertion), reflowConfig, depthMap.getDepthInfo(insertion));

        List<ReflowElement> out = new ArrayList<>(elements.size() + 2);
        if (position == InsertPosition.AFTER) {
            out.addAll(elements.subList(0, targetIdx + 1));
            out.add(ReflowPoint.empty());
            out.add(newBlock);
            out.addAll(elements.subList(targetIdx + 1, elements.size()));
            return derive(out, List.of(LintFix.createAfter(target, List.of(insertion), "Insert " + insertion.getType() + ".")));
        }
        out.addAll(elements.subList(0, targetIdx));
        out.add(newBlock);
        out.add(ReflowPoint.empty());
        out.addAll(elements.subList(targetIdx, elements.size()));
        return derive(out, List.of(LintFix.createBefore(target, List.of(insertion), "Insert " + insertion.getType() + ".")));
    }

    /**
     * Replace {@code target} (a token or a whole subtree) with {@code edit}.
     *
     * <p>New leaves take the depth of the target's first leaf, trimmed by the wrapper levels
     * that disappear with the target. The element list is rebuilt from the flattened leaves
     * rather than patched.</p>
     */
    public ReflowSequence replace(Segment target, List<? extends Segment> edit) {
        List<RawSegment> targetRaws = target.getRawSegments();
        if (targetRaws.isEmpty()) throw new IllegalArgumentException("target has no raw segments: " + target);

        List<RawSegment> editRaws = new ArrayList<>();
        for (Segment s : edit) editRaws.addAll(s.getRawSegments());

        int trimAmount = target.pathTo(targetRaws.get(0)).size();
        log.debug("Replacement trim amount: {}", trimAmount);
        for (RawSegment editRaw : editRaws) {
            depthMap.copyDepthInfo(targetRaws.get(0), editRaw, trimAmount);
        }

        List<RawSegment> currentRaws = getRawSegments();
        int startIdx = indexOf(currentRaws, targetRaws.get(0));
        int lastIdx = indexOf(currentRaws, targetRaws.get(targetRaws.size() - 1));
        if (startIdx < 0 || lastIdx < startIdx) {
            throw new IllegalArgumentException("Target [" + target + "] not found in ReflowSequence.");
        }
        List<RawSegment> rebuilt = new ArrayList<>(currentRaws.subList(0, startIdx));
        rebuilt.addAll(editRaws);
        rebuilt.addAll(currentRaws.subList(lastIdx + 1, currentRaws.size()));

        return derive(elementsFromRawSegments(rebuilt, reflowConfig, depthMap),
                List.of(LintFix.replace(target, edit, "Replace " + target.getType() + ".")));
    }

    public ReflowSequence respace() {
        return respace(false, RespaceFilter.ALL);
    }

    /**
     * Respace every point (or the filtered subset) from the spacing policy of its neighbours.
     *
     * @param stripNewlines remove line breaks first, coercing the sequence onto one line.
     *                      No priority is applied to which breaks go, so this is no
     *                      substitute for {@link #reindent()}.
     * @param filter        judged on the respaced point, so that stripping can reclaim newlines
     */
    public ReflowSequence respace(boolean stripNewlines, RespaceFilter filter) {
        RespaceFilter f = filter == null ? RespaceFilter.ALL : filter;
        List<LintFix> fixes = new ArrayList<>(embodiedFixes);
        List<ReflowElement> out = new ArrayList<>(elements);

        for (int idx = 0; idx < elements.size(); idx++) {
            if (!(elements.get(idx) instanceof ReflowPoint)) continue;
            ReflowPoint point = (ReflowPoint) elements.get(idx);
            ReflowBlock pre = idx > 0 ? (ReflowBlock) elements.get(idx - 1) : null;
            ReflowBlock post = idx < elements.size() - 1 ? (ReflowBlock) elements.get(idx + 1) : null;

            ReflowPoint.Result r = point.respace(pre, post, fixes, stripNewlines);
            ReflowPoint newPoint = r.getPoint();
            boolean lineBreakLike = newPoint.getNumNewlines() > 0 || (post != null && post.isEndOfFile());
            boolean skip = lineBreakLike ? f == RespaceFilter.INLINE : f == RespaceFilter.NEWLINE;
            if (skip) {
                log.debug("    Filter {} applied. Resetting {}", f, point);
                continue;
            }
            out.set(idx, newPoint);
            fixes = new ArrayList<>(r.getFixes());
        }
        return new ReflowSequence(out, rootSegment, reflowConfig, depthMap, fixes, eventSink);
    }

    /**
     * Move tokens with a configured line position across adjacent line breaks.
     * Indentation is assumed correct and is not changed.
     */
    public ReflowSequence rebreak() {
        requireNoEmbodiedFixes("rebreak");
        LintedElements r = Rebreaker.rebreak(elements, reflowConfig, depthMap, eventSink);
        return new ReflowSequence(r.getElements(), rootSegment, reflowConfig, depthMap, r.getFixes(), eventSink);
    }

    /**
     * Fix line breaks and indentation, then break lines that are too long.
     *
     * @throws ReflowConfigException if the configured indent unit is invalid
     */
    public ReflowSequence reindent() {
        requireNoEmbodiedFixes("reindent");
        String singleIndent = reflowConfig.constructSingleIndent();

        LintedElements indented = Reindenter.lintIndentPoints(
                elements, singleIndent, reflowConfig.getSkipIndentationIn(), eventSink);
        LintedElements wrapped = LineLengthLinter.lintLineLength(
                indented.getElements(), singleIndent, reflowConfig.getMaxLineLength(), eventSink);

        List<LintFix> fixes = new ArrayList<>(indented.getFixes());
        fixes.addAll(wrapped.getFixes());
        return new ReflowSequence(wrapped.getElements(), rootSegment, reflowConfig, depthMap, fixes, eventSink);
    }

    private void requireNoEmbodiedFixes(String operation) {
        if (!embodiedFixes.isEmpty()) {
            throw new IllegalStateException(operation + " cannot handle pre-existing embodied fixes ("
                    + embodiedFixes.size() + ")");
        }
    }

    // ------------------------------------------------------------
    // helpers
    // ------------------------------------------------------------

    private static int indexOf(List<RawSegment> raws, RawSegment target) {
        for (int i = 0; i < raws.size(); i++) {
            if (raws.get(i) == target) return i;
        }
        return -1;
    }

    private static String render(List<RawSegment> raws) {
        StringBuilder sb = new StringBuilder();
        for (RawSegment r : raws) sb.append(r.getRaw());
        return sb.toString();
    }

    /** Result of {@link #getPartitionedFixes(Segment)}. */
    public static final class PartitionedFixes {

        private final List<LintFix> before;
        private final List<LintFix> within;
        private final List<LintFix> after;

        PartitionedFixes(List<LintFix> before, List<LintFix> within, List<LintFix> after) {
            this.before = Collections.unmodifiableList(before);
            this.within = Collections.unmodifiableList(within);
            this.after = Collections.unmodifiableList(after);
        }

        public List<LintFix> getBefore() {
            return before;
        }

        public List<LintFix> getWithin() {
            return within;
        }

        public List<LintFix> getAfter() {
            return after;
        }
    }
}
