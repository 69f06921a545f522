package com.ryuqq.transferchain.core.spi;

/**
 * Fatal state access failure (I/O error or write conflict).
 *
 * <p>Unlike a validation {@code Fail}, this is not attributable to the submitter.
 * It propagates out of the transition core unchanged so the host runtime can
 * decide how to handle the request.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public class StateStoreException extends RuntimeException {

    /**
     * Creates a new exception.
     *
     * @param message the detail message
     */
    public StateStoreException(String message) {
        super(message);
    }

    /**
     * Creates a new exception with a cause.
     *
     * @param message the detail message
     * @param cause the underlying failure
     */
    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
