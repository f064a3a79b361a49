package in.quotestream.domain.feed;

/**
 * Thrown when a client names an unsupported asset class or a malformed symbol.
 * Rejected at subscribe time; never reaches the scheduler.
 */
public class InvalidFeedKeyException extends RuntimeException {

    public InvalidFeedKeyException(String message) {
        super(message);
    }
}
