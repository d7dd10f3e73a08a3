package domain.model;

/**
 * Standard event codes for reflow diagnostics.
 *
 * <p>Keep the set small and stable.</p>
 */
public enum ReflowEventCode {

    /**
     * Leading whitespace of a line was changed.
     */
    INDENT_CORRECTED,

    /**
     * An indent was opened without a same-line dedent and no break followed it.
     */
    MISSING_BREAK_ON_INDENT,

    /**
     * A taken indent was closed without a line break.
     */
    MISSING_BREAK_ON_DEDENT,

    /**
     * Template tags of one block were moved to a shared indent.
     */
    TEMPLATE_LINES_REVISED,

    /**
     * Comment-only line was anchored to the following code line (or to the baseline).
     */
    COMMENT_LINE_ANCHORED,

    /**
     * Line was not reindented because it lies inside a skipped segment type.
     */
    INDENT_SKIPPED,

    /**
     * Line exceeded the maximum length and a break was inserted.
     */
    LINE_BROKEN,

    /**
     * Line exceeds the maximum length and has no permitted break point.
     */
    LINE_TOO_LONG,

    /**
     * Token was moved across a line break by rebreak.
     */
    TOKEN_MOVED,

    /**
     * Fix anchor was no longer present while building report entries.
     */
    ANCHOR_NOT_FOUND
}
