package domain.model;
/** No-op event sink. */
final class NullReflowEventSink implements ReflowEventSink {

    static final NullReflowEventSink INSTANCE = new NullReflowEventSink();

    private NullReflowEventSink() {
    }

    @Override
    public void emit(ReflowEvent event) {
        // no-op
    }
}
