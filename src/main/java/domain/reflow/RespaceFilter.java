package domain.reflow;

/** Which points {@link ReflowSequence#respace(boolean, RespaceFilter)} may change. */
public enum RespaceFilter {

    ALL,

    /** Only points with a line break or followed by the end of the file (trailing whitespace). */
    NEWLINE,

    /** Only points within a line. */
    INLINE
}
