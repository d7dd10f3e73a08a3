package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>We deduplicate by (code|line|pos|message|detail). The line-length pass revisits a
 * line until it stops changing, so the same finding can be raised more than once.</p>
 */
public final class ListReflowEventSink implements ReflowEventSink {

    private final List<ReflowEvent> target;
    private final Set<String> seen = new HashSet<>(256);

    public ListReflowEventSink(List<ReflowEvent> target) {
        this.target = target;
    }

    private static String key(ReflowEvent e) {
        return (e.getCode() == null ? "" : e.getCode()
                .name()) + "|"
                + e.getLineNo() + "|"
                + e.getLinePos() + "|"
                + safe(e.getMessage()) + "|"
                + safe(e.getDetail());
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    @Override
    public void emit(ReflowEvent event) {
        if (event == null || target == null) return;
        if (seen.add(key(event))) {
            target.add(event);
        }
    }
}
