package domain.reflow;

import domain.lint.LintFix;
import domain.model.ReflowEvent;
import domain.model.ReflowEventCode;
import domain.model.ReflowEventSink;
import domain.segment.RawSegment;
import domain.segment.SegmentKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves tokens with a configured line position to the correct side of a line break.
 *
 * <ul>
 *   <li>{@link LinePosition#TRAILING}: {@code a\n    , b} becomes {@code a,\n    b}</li>
 *   <li>{@link LinePosition#LEADING}: {@code a +\n    b} becomes {@code a\n    + b}</li>
 * </ul>
 *
 * <p>The whitespace after the line break stays where it is, so indentation is unchanged.
 * Tokens are never moved next to a comment.</p>
 */
final class Rebreaker {

    private static final Logger log = LoggerFactory.getLogger(Rebreaker.class);

    private Rebreaker() {
    }

    static LintedElements rebreak(
            List<ReflowElement> elements,
            ReflowConfig config,
            DepthMap depthMap,
            ReflowEventSink sink
    ) {
        ReflowEventSink events = sink == null ? ReflowEventSink.none() : sink;
        List<ReflowElement> buffer = new ArrayList<>(elements);
        List<LintFix> fixes = new ArrayList<>();

        for (int idx = 2; idx + 2 < buffer.size(); idx++) {
            if (!(buffer.get(idx) instanceof ReflowBlock)) continue;
            ReflowBlock target = (ReflowBlock) buffer.get(idx);
            LinePosition position = target.getLinePosition();
            if (position == null) continue;

            ReflowPoint pre = (ReflowPoint) buffer.get(idx - 1);
            ReflowPoint post = (ReflowPoint) buffer.get(idx + 1);
            ReflowBlock prev = (ReflowBlock) buffer.get(idx - 2);
            ReflowBlock next = (ReflowBlock) buffer.get(idx + 2);

            if (position == LinePosition.TRAILING
                    && pre.getNumNewlines() > 0 && post.getNumNewlines() == 0
                    && !isComment(prev) && !next.isEndOfFile()) {
                moveToEndOfPreviousLine(buffer, idx, config, depthMap, fixes);
                events.emit(ReflowEvent.at(ReflowEventCode.TOKEN_MOVED, target.getSegment(),
                        target.getSegment().getType() + " moved to end of previous line", position.name()));
            } else if (position == LinePosition.LEADING
                    && pre.getNumNewlines() == 0 && post.getNumNewlines() > 0
                    && !isComment(next) && !next.isEndOfFile()) {
                moveToStartOfNextLine(buffer, idx, config, depthMap, fixes);
                events.emit(ReflowEvent.at(ReflowEventCode.TOKEN_MOVED, target.getSegment(),
                        target.getSegment().getType() + " moved to start of next line", position.name()));
            }
        }
        return new LintedElements(buffer, fixes);
    }

    private static void moveToEndOfPreviousLine(
            List<ReflowElement> buffer, int idx, ReflowConfig config, DepthMap depthMap, List<LintFix> fixes) {
        ReflowBlock prev = (ReflowBlock) buffer.get(idx - 2);
        ReflowPoint pre = (ReflowPoint) buffer.get(idx - 1);
        RawSegment token = ((ReflowBlock) buffer.get(idx)).getSegment();
        ReflowPoint post = (ReflowPoint) buffer.get(idx + 1);
        String description = "Found leading " + token.getType() + ". Expected only trailing.";
        log.debug("Moving {} to end of previous line", token);

        List<RawSegment> merged = new ArrayList<>(pre.getSegments());
        for (RawSegment seg : post.getSegments()) {
            if (seg.getKind() == SegmentKind.WHITESPACE) fixes.add(LintFix.delete(seg, description));
            else merged.add(seg);
        }
        RawSegment moved = token.detachedCopy();
        depthMap.copyDepthInfo(token, moved);
        fixes.add(LintFix.delete(token, description));
        fixes.add(LintFix.createAfter(prev.getSegment(), List.of(moved), description));

        buffer.set(idx - 1, ReflowPoint.empty());
        buffer.set(idx, ReflowBlock.fromConfig(List.of(moved), config, depthMap.getDepthInfo(moved)));
        buffer.set(idx + 1, new ReflowPoint(merged));
    }

    private static void moveToStartOfNextLine(
            List<ReflowElement> buffer, int idx, ReflowConfig config, DepthMap depthMap, List<LintFix> fixes) {
        ReflowPoint pre = (ReflowPoint) buffer.get(idx - 1);
        RawSegment token = ((ReflowBlock) buffer.get(idx)).getSegment();
        ReflowPoint post = (ReflowPoint) buffer.get(idx + 1);
        ReflowBlock next = (ReflowBlock) buffer.get(idx + 2);
        String description = "Found trailing " + token.getType() + ". Expected only leading.";
        log.debug("Moving {} to start of next line", token);

        List<RawSegment> merged = new ArrayList<>();
        for (RawSegment seg : pre.getSegments()) {
            if (seg.getKind() == SegmentKind.WHITESPACE) fixes.add(LintFix.delete(seg, description));
            else merged.add(seg);
        }
        merged.addAll(post.getSegments());
        RawSegment moved = token.detachedCopy();
        depthMap.copyDepthInfo(token, moved);
        RawSegment space = RawSegment.whitespace(" ");
        fixes.add(LintFix.delete(token, description));
        fixes.add(LintFix.createBefore(next.getSegment(), List.of(moved, space), description));

        buffer.set(idx - 1, new ReflowPoint(merged));
        buffer.set(idx, ReflowBlock.fromConfig(List.of(moved), config, depthMap.getDepthInfo(moved)));
        buffer.set(idx + 1, new ReflowPoint(List.of(space)));
    }

    private static boolean isComment(ReflowBlock block) {
        return block.getSegment().getKind() == SegmentKind.COMMENT;
    }
}
