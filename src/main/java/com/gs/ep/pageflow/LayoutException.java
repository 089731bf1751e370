package com.gs.ep.pageflow;

/**
 * Raised when layout input is structurally inconsistent, for example a row index beyond the measured
 * rows. Such input is a defect upstream; the layout pass is not retried.
 */
public class LayoutException extends RuntimeException {

    public LayoutException(String message) {
        super(message);
    }

    public LayoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
