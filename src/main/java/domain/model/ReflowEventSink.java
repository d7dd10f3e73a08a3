package domain.model;

/**
 * Sink for reflow diagnostics.
 *
 * <p>Events are produced deep inside the indent and line-length passes. A sink lets callers
 * collect them without the reflow code depending on how they are reported. Events never
 * change the fixes that are produced.</p>
 */
public interface ReflowEventSink {

    static ReflowEventSink none() {
        return NullReflowEventSink.INSTANCE;
    }

    void emit(ReflowEvent event);
}
