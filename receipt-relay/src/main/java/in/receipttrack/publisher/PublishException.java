package in.receipttrack.publisher;

/**
 * Submission of an event to the channel failed. The event was not published.
 */
public class PublishException extends Exception {

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
