package stitcher.taskcenter.store;

/**
 * Persistence failure. Wraps the driver exception, with the failed operation in the message.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
