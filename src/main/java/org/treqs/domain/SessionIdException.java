package org.treqs.domain;

/** The secure random source failed; no session id can be issued. */
public class SessionIdException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public SessionIdException(String message, Throwable cause) {
        super(message, cause);
    }
}
