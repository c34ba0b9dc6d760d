package in.receipttrack.relay.codec;

/**
 * Thrown when a channel payload cannot be turned into a receipt event.
 * Such payloads are permanently unprocessable; redelivery will not fix them.
 */
public class EventDecodingException extends Exception {

    public EventDecodingException(String message) {
        super(message);
    }

    public EventDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
