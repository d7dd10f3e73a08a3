package domain.reflow;

import domain.lint.LintFix;

import java.util.Collections;
import java.util.List;

/**
 * Elements after a reflow pass plus the fixes that pass produced.
 */
final class LintedElements {

    private final List<ReflowElement> elements;
    private final List<LintFix> fixes;

    LintedElements(List<ReflowElement> elements, List<LintFix> fixes) {
        this.elements = Collections.unmodifiableList(elements);
        this.fixes = Collections.unmodifiableList(fixes);
    }

    List<ReflowElement> getElements() {
        return elements;
    }

    List<LintFix> getFixes() {
        return fixes;
    }
}
