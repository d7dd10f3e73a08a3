package domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListReflowEventSinkTest {

    @Test
    void repeated_events_are_recorded_once() {
        List<ReflowEvent> events = new ArrayList<>();
        ReflowEventSink sink = new ListReflowEventSink(events);

        sink.emit(new ReflowEvent(ReflowEventCode.LINE_TOO_LONG, 3, 1, "Line is too long", "95 > 80"));
        sink.emit(new ReflowEvent(ReflowEventCode.LINE_TOO_LONG, 3, 1, "Line is too long", "95 > 80"));
        sink.emit(new ReflowEvent(ReflowEventCode.LINE_TOO_LONG, 4, 1, "Line is too long", "95 > 80"));
        sink.emit(null);

        assertEquals(2, events.size());
        assertEquals(4, events.get(1).getLineNo());
    }

    @Test
    void unlocated_event_has_zero_position() {
        ReflowEvent e = ReflowEvent.at(ReflowEventCode.INDENT_SKIPPED, null, null, null);

        assertEquals(0, e.getLineNo());
        assertEquals(0, e.getLinePos());
        assertEquals("", e.getMessage());
        assertEquals(ReflowEventCode.INDENT_SKIPPED, e.getCode());
    }

    @Test
    void null_sink_discards() {
        assertDoesNotThrow(() -> ReflowEventSink.none()
                .emit(new ReflowEvent(ReflowEventCode.TOKEN_MOVED, 1, 1, "moved", "")));
    }
}
