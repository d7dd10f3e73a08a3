package domain.reflow;

import java.util.Locale;

/** Where a block belongs relative to a line break that is adjacent to it. */
public enum LinePosition {

    /** At the start of the following line (e.g. {@code AND}, {@code +}). */
    LEADING,

    /** At the end of the preceding line (e.g. {@code ,}). */
    TRAILING;

    static LinePosition parse(String raw, String key) {
        String v = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "leading" -> LEADING;
            case "trailing" -> TRAILING;
            default -> throw new ReflowConfigException(
                    "Expected 'leading' or 'trailing' for " + key + ", instead got '" + raw + "'");
        };
    }
}
