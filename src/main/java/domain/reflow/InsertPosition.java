package domain.reflow;

/** Where {@link ReflowSequence#insert} places the new block relative to its target. */
public enum InsertPosition {
    BEFORE,
    AFTER
}
