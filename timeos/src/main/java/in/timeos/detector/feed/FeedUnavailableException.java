package in.timeos.detector.feed;

/**
 * A source feed could not be read. Fails the whole detector run.
 */
public class FeedUnavailableException extends RuntimeException {
    public FeedUnavailableException(String message) {
        super(message);
    }

    public FeedUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
