package domain.lint;

import domain.segment.RawSegment;
import domain.segment.Segment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An atomic edit against the original tree.
 *
 * <p>The anchor is always a segment of the original tree so that the fix can be placed
 * and reported. Fixes are immutable; {@link #withEdit(List)} is used to amend one.</p>
 */
public final class LintFix {

    public enum EditType {
        DELETE,
        CREATE_BEFORE,
        CREATE_AFTER,
        REPLACE
    }

    private final EditType editType;
    private final Segment anchor;
    private final List<Segment> edit;
    private final String description;

    private LintFix(EditType editType, Segment anchor, List<? extends Segment> edit, String description) {
        if (editType == null) throw new IllegalArgumentException("editType is null");
        if (anchor == null) throw new IllegalArgumentException("anchor is null");
        if (editType != EditType.DELETE && (edit == null || edit.isEmpty())) {
            throw new IllegalArgumentException(editType + " requires a non-empty edit");
        }
        this.editType = editType;
        this.anchor = anchor;
        this.edit = edit == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(edit));
        this.description = description == null ? "" : description;
    }

    public static LintFix delete(Segment anchor) {
        return new LintFix(EditType.DELETE, anchor, null, "");
    }

    public static LintFix delete(Segment anchor, String description) {
        return new LintFix(EditType.DELETE, anchor, null, description);
    }

    public static LintFix replace(Segment anchor, List<? extends Segment> edit) {
        return new LintFix(EditType.REPLACE, anchor, edit, "");
    }

    public static LintFix replace(Segment anchor, List<? extends Segment> edit, String description) {
        return new LintFix(EditType.REPLACE, anchor, edit, description);
    }

    public static LintFix createBefore(Segment anchor, List<? extends Segment> edit) {
        return new LintFix(EditType.CREATE_BEFORE, anchor, edit, "");
    }

    public static LintFix createBefore(Segment anchor, List<? extends Segment> edit, String description) {
        return new LintFix(EditType.CREATE_BEFORE, anchor, edit, description);
    }

    public static LintFix createAfter(Segment anchor, List<? extends Segment> edit) {
        return new LintFix(EditType.CREATE_AFTER, anchor, edit, "");
    }

    public static LintFix createAfter(Segment anchor, List<? extends Segment> edit, String description) {
        return new LintFix(EditType.CREATE_AFTER, anchor, edit, description);
    }

    public LintFix withEdit(List<? extends Segment> newEdit) {
        if (editType == EditType.DELETE) {
            // A deletion that gains content becomes a replacement.
            return new LintFix(EditType.REPLACE, anchor, newEdit, description);
        }
        return new LintFix(editType, anchor, newEdit, description);
    }

    public EditType getEditType() {
        return editType;
    }

    public Segment getAnchor() {
        return anchor;
    }

    public List<Segment> getEdit() {
        return edit;
    }

    public String getDescription() {
        return description;
    }

    /** Concatenated raw text of the edit. */
    public String getEditRaw() {
        StringBuilder sb = new StringBuilder();
        for (Segment s : edit) sb.append(s.getRaw());
        return sb.toString();
    }

    /** True when {@code seg} is one of the tokens this fix introduces. */
    public boolean introduces(RawSegment seg) {
        for (Segment s : edit) {
            for (RawSegment r : s.getRawSegments()) {
                if (r == seg) return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "LintFix(" + editType + ", anchor=" + anchor + (edit.isEmpty() ? "" : ", edit=" + edit) + ")";
    }
}
