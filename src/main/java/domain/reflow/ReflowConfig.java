package domain.reflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Layout configuration consumed by the reflow engine.
 *
 * <p>Loading it from files is the caller's job; {@link #fromProperties(Map)} accepts the
 * flat key/value form a config loader would produce:</p>
 * <ul>
 *   <li>{@code indent_unit} = tab | space</li>
 *   <li>{@code tab_space_size} = spaces per indent when the unit is space</li>
 *   <li>{@code max_line_length} = 0 or less disables the line-length pass</li>
 *   <li>{@code skip_indentation_in} = comma separated segment types</li>
 *   <li>{@code type.<type>.spacing_before|spacing_after|spacing_within} = single | touch | any</li>
 *   <li>{@code type.<type>.line_position} = leading | trailing</li>
 * </ul>
 */
public final class ReflowConfig {

    public static final String INDENT_UNIT_SPACE = "space";
    public static final String INDENT_UNIT_TAB = "tab";

    private static final String TYPE_PREFIX = "type.";

    private final String indentUnit;
    private final int tabSpaceSize;
    private final int maxLineLength;
    private final Set<String> skipIndentationIn;
    private final Map<String, TypeLayoutConfig> typeConfigs;

    private ReflowConfig(Builder b) {
        this.indentUnit = b.indentUnit;
        this.tabSpaceSize = b.tabSpaceSize;
        this.maxLineLength = b.maxLineLength;
        this.skipIndentationIn = Collections.unmodifiableSet(new LinkedHashSet<>(b.skipIndentationIn));
        this.typeConfigs = Collections.unmodifiableMap(new LinkedHashMap<>(b.typeConfigs));
    }

    public static ReflowConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Config from flat properties, starting from {@link #defaults()}.
     *
     * @throws ReflowConfigException on unparseable values
     */
    public static ReflowConfig fromProperties(Map<String, String> props) {
        Builder b = builder();
        if (props == null) return b.build();

        for (Map.Entry<String, String> e : props.entrySet()) {
            String key = e.getKey() == null ? "" : e.getKey().trim();
            String value = e.getValue();
            switch (key) {
                case "indent_unit" -> b.indentUnit(value == null ? "" : value.trim().toLowerCase(Locale.ROOT));
                case "tab_space_size" -> b.tabSpaceSize(parseInt(key, value));
                case "max_line_length" -> b.maxLineLength(parseInt(key, value));
                case "skip_indentation_in" -> {
                    for (String t : (value == null ? "" : value).split(",")) {
                        if (!t.isBlank()) b.skipIndentationIn(t.trim());
                    }
                }
                default -> {
                    if (key.startsWith(TYPE_PREFIX)) {
                        applyTypeProperty(b, key, value);
                    }
                    // unrelated keys belong to other parts of the linter config
                }
            }
        }
        return b.build();
    }

    private static void applyTypeProperty(Builder b, String key, String value) {
        String rest = key.substring(TYPE_PREFIX.length());
        int dot = rest.lastIndexOf('.');
        if (dot <= 0) throw new ReflowConfigException("Malformed layout key: " + key);
        String type = rest.substring(0, dot);
        String setting = rest.substring(dot + 1);
        TypeLayoutConfig cfg = switch (setting) {
            case "spacing_before" -> TypeLayoutConfig.before(Spacing.parse(value, key));
            case "spacing_after" -> TypeLayoutConfig.after(Spacing.parse(value, key));
            case "spacing_within" -> TypeLayoutConfig.within(Spacing.parse(value, key));
            case "line_position" -> TypeLayoutConfig.position(LinePosition.parse(value, key));
            default -> throw new ReflowConfigException("Unknown layout setting '" + setting + "' in " + key);
        };
        b.type(type, cfg);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw new ReflowConfigException("Expected an integer for " + key + ", instead got '" + value + "'", e);
        }
    }

    /**
     * One level of indentation as text.
     *
     * @throws ReflowConfigException when the indent unit is neither tab nor space
     */
    public String constructSingleIndent() {
        if (INDENT_UNIT_TAB.equals(indentUnit)) {
            return "\t";
        } else if (INDENT_UNIT_SPACE.equals(indentUnit)) {
            return " ".repeat(tabSpaceSize);
        }
        throw new ReflowConfigException("Expected indent_unit of 'tab' or 'space', instead got " + indentUnit);
    }

    /**
     * Resolve the layout of a block from its class types. The block's own type wins over
     * the extra types it carries.
     */
    public TypeLayoutConfig getBlockConfig(String ownType, Set<String> classTypes) {
        TypeLayoutConfig cfg = new TypeLayoutConfig(Spacing.SINGLE, Spacing.SINGLE, null, null);
        for (String t : classTypes) {
            if (t.equals(ownType)) continue;
            cfg = cfg.merge(typeConfigs.get(t));
        }
        return cfg.merge(typeConfigs.get(ownType));
    }

    /** Spacing configured within a parent segment type, or null. */
    public Spacing getSpacingWithin(Set<String> classTypes) {
        Spacing found = null;
        for (String t : classTypes) {
            TypeLayoutConfig cfg = typeConfigs.get(t);
            if (cfg != null && cfg.getSpacingWithin() != null) found = cfg.getSpacingWithin();
        }
        return found;
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    public int getTabSpaceSize() {
        return tabSpaceSize;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public Set<String> getSkipIndentationIn() {
        return skipIndentationIn;
    }

    public Map<String, TypeLayoutConfig> getTypeConfigs() {
        return typeConfigs;
    }

    public static final class Builder {

        private String indentUnit = INDENT_UNIT_SPACE;
        private int tabSpaceSize = 4;
        private int maxLineLength = 80;
        private final Set<String> skipIndentationIn = new LinkedHashSet<>();
        private final Map<String, TypeLayoutConfig> typeConfigs = new LinkedHashMap<>();

        private Builder() {
            type("comma", new TypeLayoutConfig(Spacing.TOUCH, null, null, LinePosition.TRAILING));
            type("semicolon", TypeLayoutConfig.before(Spacing.TOUCH));
            type("dot", new TypeLayoutConfig(Spacing.TOUCH, Spacing.TOUCH, null, null));
            type("casting_operator", new TypeLayoutConfig(Spacing.TOUCH, Spacing.TOUCH, null, null));
            type("start_bracket", TypeLayoutConfig.after(Spacing.TOUCH));
            type("end_bracket", TypeLayoutConfig.before(Spacing.TOUCH));
            type("binary_operator", TypeLayoutConfig.position(LinePosition.LEADING));
            type("comment", TypeLayoutConfig.before(Spacing.ANY));
            type("function", TypeLayoutConfig.within(Spacing.TOUCH));
            type("end_of_file", TypeLayoutConfig.before(Spacing.TOUCH));
        }

        public Builder indentUnit(String indentUnit) {
            this.indentUnit = indentUnit;
            return this;
        }

        public Builder tabSpaceSize(int tabSpaceSize) {
            if (tabSpaceSize < 0) throw new ReflowConfigException("tab_space_size must not be negative: " + tabSpaceSize);
            this.tabSpaceSize = tabSpaceSize;
            return this;
        }

        public Builder maxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder skipIndentationIn(String type) {
            this.skipIndentationIn.add(type);
            return this;
        }

        /** Adds to (or overrides parts of) the settings of {@code type}. */
        public Builder type(String type, TypeLayoutConfig config) {
            TypeLayoutConfig existing = typeConfigs.get(type);
            typeConfigs.put(type, existing == null ? config : existing.merge(config));
            return this;
        }

        public ReflowConfig build() {
            return new ReflowConfig(this);
        }
    }
}
