package domain.reflow;

/**
 * Invalid layout configuration supplied by the user (e.g. an unknown indent unit).
 *
 * <p>Unlike precondition violations this is not a programming error: the message is meant
 * to be shown as-is.</p>
 */
public class ReflowConfigException extends RuntimeException {

    public ReflowConfigException(String message) {
        super(message);
    }

    public ReflowConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
