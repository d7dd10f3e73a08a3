package domain.segment;

/**
 * Coarse token kind produced by the dialect layer.
 */
public enum SegmentKind {

    CODE,
    WHITESPACE,
    NEWLINE,

    /**
     * Zero-width structural marker (+1 indent or -1 dedent).
     */
    INDENT,
    COMMENT,

    /**
     * Template tag or templated literal (source differs from rendered output).
     */
    PLACEHOLDER,
    TEMPLATE_LOOP,
    END_OF_FILE;

    /**
     * Default type name used in the spacing config table.
     */
    public String typeName() {
        return switch (this) {
            case CODE -> "code";
            case WHITESPACE -> "whitespace";
            case NEWLINE -> "newline";
            case INDENT -> "indent";
            case COMMENT -> "comment";
            case PLACEHOLDER -> "placeholder";
            case TEMPLATE_LOOP -> "template_loop";
            case END_OF_FILE -> "end_of_file";
        };
    }
}
