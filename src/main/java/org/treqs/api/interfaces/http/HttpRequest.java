package org.treqs.api.interfaces.http;

import java.util.List;

/** Minimal request contract */
public interface HttpRequest {
    String method();
    String path();
    String version();

    /** First value of the header, matched case-insensitively, or null. */
    String header(String name);

    /** Header names in arrival order, duplicates included, original case kept. */
    List<String> headerNames();

    /** Removes every header with this name regardless of case. */
    void removeHeader(String name);

    /** First value of a query string parameter, or null. */
    String query(String name);

    byte[] body();
}
