package org.treqs.domain;

/** Wire names of the control headers. */
public final class TreqsHeaders {
    public static final String KEY = "X-Treqs-Key";
    public static final String ACTION = "X-Treqs-Action";
    public static final String ID = "X-Treqs-Id";

    private TreqsHeaders() {}
}
