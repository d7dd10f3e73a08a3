package domain.reflow;

/** Which side(s) of a target {@link ReflowSequence#fromAroundTarget} expands to. */
public enum Sides {
    BOTH,
    BEFORE,
    AFTER
}
