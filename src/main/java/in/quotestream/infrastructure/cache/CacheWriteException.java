package in.quotestream.infrastructure.cache;

/**
 * Snapshot could not be written. Non-fatal: logged by the caller and the
 * update is still broadcast.
 */
public class CacheWriteException extends Exception {

    public CacheWriteException(String message) {
        super(message);
    }

    public CacheWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
