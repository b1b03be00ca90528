package stitcher.taskcenter.model;

/**
 * Malformed request rejected before anything is persisted.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
