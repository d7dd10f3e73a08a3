package domain.model;

import domain.segment.PositionMarker;
import domain.segment.Segment;

/**
 * A single diagnostic emitted while reflowing.
 *
 * <p>Line and position are 0 when the event is not tied to a source location.</p>
 */
public final class ReflowEvent {

    private final ReflowEventCode code;
    private final int lineNo;
    private final int linePos;
    private final String message;
    private final String detail;

    public ReflowEvent(ReflowEventCode code, int lineNo, int linePos, String message, String detail) {
        this.code = code == null ? ReflowEventCode.INDENT_CORRECTED : code;
        this.lineNo = Math.max(0, lineNo);
        this.linePos = Math.max(0, linePos);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    /** Event located at {@code at}, or unlocated when it has no position. */
    public static ReflowEvent at(ReflowEventCode code, Segment at, String message, String detail) {
        PositionMarker pm = at == null ? null : at.getPositionMarker();
        if (pm == null) return new ReflowEvent(code, 0, 0, message, detail);
        return new ReflowEvent(code, pm.getLineNo(), pm.getLinePos(), message, detail);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public ReflowEventCode getCode() {
        return code;
    }

    public int getLineNo() {
        return lineNo;
    }

    public int getLinePos() {
        return linePos;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return code + " L" + lineNo + ":P" + linePos + " " + message + (detail.isEmpty() ? "" : " (" + detail + ")");
    }
}
