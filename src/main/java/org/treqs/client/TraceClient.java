package org.treqs.client;

import org.treqs.domain.TreqsHeaders;

import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Talks the tracing protocol to a server: trace a request, read the capture back, reset.
 */
public final class TraceClient {
    private static final int DEFAULT_TIMEOUT_MS = 60_000;

    private final String host;
    private final int port;
    private final String path;
    private final String key;
    private final RawHttpClient http;

    public TraceClient(String url, String key) {
        this(url, key, new RawHttpClient(DEFAULT_TIMEOUT_MS));
    }

    public TraceClient(String url, String key, RawHttpClient http) {
        URI uri = URI.create(url.contains("://") ? url : "http://" + url);
        if (!"http".equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException("only http:// URLs are supported: " + url);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("missing host in URL: " + url);
        }
        this.host = uri.getHost();
        this.port = uri.getPort() > 0 ? uri.getPort() : 80;
        String p = (uri.getRawPath() == null || uri.getRawPath().isEmpty()) ? "/" : uri.getRawPath();
        this.path = uri.getRawQuery() == null ? p : p + "?" + uri.getRawQuery();
        this.key = key;
        this.http = http;
    }

    /** Issues the request with the trace action. The response carries the new id on success. */
    public RawResponse trace(String method) throws IOException {
        return http.exchange(method, host, port, path, control("trace", null));
    }

    /**
     * Traces a request and returns its session id.
     *
     * @throws IOException if the server did not return an id
     */
    public String traceId(String method) throws IOException {
        RawResponse res = trace(method);
        String id = res.header(TreqsHeaders.ID);
        if (id == null || id.isEmpty()) {
            throw new IOException("trace request failed, " + TreqsHeaders.ID + " header missing in response (status "
                    + res.status() + ")");
        }
        return id;
    }

    public RawResponse read(String method, String id) throws IOException {
        return http.exchange(method, host, port, path, control("read", id));
    }

    public RawResponse reset() throws IOException {
        return http.exchange("GET", host, port, path, control("reset", null));
    }

    private Map<String, String> control(String action, String id) {
        Map<String, String> h = new LinkedHashMap<>();
        h.put(TreqsHeaders.ACTION, action);
        h.put(TreqsHeaders.KEY, key);
        if (id != null) h.put(TreqsHeaders.ID, id);
        return h;
    }
}
