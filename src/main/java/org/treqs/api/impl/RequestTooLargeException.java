package org.treqs.api.impl;

import java.io.IOException;

/** The request declared a body larger than the server accepts. */
public class RequestTooLargeException extends IOException {
    private final long declared;

    public RequestTooLargeException(long declared, long limit) {
        super("request body of " + declared + " bytes exceeds the limit of " + limit + " bytes");
        this.declared = declared;
    }

    public long declared() {
        return declared;
    }
}
