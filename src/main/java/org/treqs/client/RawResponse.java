package org.treqs.client;

import java.util.List;
import java.util.Map;

/** Parsed response: status line, headers in arrival order, body bytes untouched. */
public final class RawResponse {
    private final int status;
    private final String reason;
    private final List<Map.Entry<String, String>> headers;
    private final byte[] body;

    public RawResponse(int status, String reason, List<Map.Entry<String, String>> headers, byte[] body) {
        this.status = status;
        this.reason = reason;
        this.headers = List.copyOf(headers);
        this.body = body;
    }

    public int status() { return status; }
    public String reason() { return reason; }
    public List<Map.Entry<String, String>> headers() { return headers; }
    public byte[] body() { return body; }

    public String header(String name) {
        for (Map.Entry<String, String> e : headers) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }
}
