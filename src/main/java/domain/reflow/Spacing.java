package domain.reflow;

import java.util.Locale;

/** Horizontal spacing policy on one side of a block. */
public enum Spacing {

    /** Exactly one space. */
    SINGLE,

    /** No space at all. */
    TOUCH,

    /** Leave whatever is there. */
    ANY;

    static Spacing parse(String raw, String key) {
        String v = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "single" -> SINGLE;
            case "touch" -> TOUCH;
            case "any" -> ANY;
            default -> throw new ReflowConfigException(
                    "Expected 'single', 'touch' or 'any' for " + key + ", instead got '" + raw + "'");
        };
    }
}
