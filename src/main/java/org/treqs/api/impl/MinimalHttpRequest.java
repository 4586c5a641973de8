package org.treqs.api.impl;

import org.treqs.api.interfaces.http.HttpRequest;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class MinimalHttpRequest implements HttpRequest {
    private final String method;
    private final String path;
    private final String version;
    // kept as a list so duplicates and original case survive until scrubbed
    private final List<Map.Entry<String, String>> headers;
    private final byte[] body;

    public MinimalHttpRequest(String method, String path, String version,
                              List<Map.Entry<String, String>> headers, byte[] body) {
        this.method = method;
        this.path = path;
        this.version = version;
        this.headers = new ArrayList<>(headers);
        this.body = body == null ? new byte[0] : body;
    }

    /** Convenience for handlers and tests. */
    public static MinimalHttpRequest of(String method, String path, String... nameValuePairs) {
        if (nameValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("headers must be name/value pairs");
        }
        List<Map.Entry<String, String>> hs = new ArrayList<>();
        for (int i = 0; i < nameValuePairs.length; i += 2) {
            hs.add(new AbstractMap.SimpleImmutableEntry<>(nameValuePairs[i], nameValuePairs[i + 1]));
        }
        return new MinimalHttpRequest(method, path, "HTTP/1.1", hs, new byte[0]);
    }

    @Override public String method() { return method; }
    @Override public String path() { return path; }
    @Override public String version() { return version; }

    @Override
    public synchronized String header(String name) {
        if (name == null) return null;
        for (Map.Entry<String, String> e : headers) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    @Override
    public synchronized List<String> headerNames() {
        List<String> names = new ArrayList<>(headers.size());
        for (Map.Entry<String, String> e : headers) names.add(e.getKey());
        return names;
    }

    @Override
    public synchronized void removeHeader(String name) {
        if (name == null) return;
        headers.removeIf(e -> e.getKey().equalsIgnoreCase(name));
    }

    @Override
    public String query(String name) {
        int q = path.indexOf('?');
        if (name == null || q < 0) return null;
        for (String pair : path.substring(q + 1).split("&")) {
            int eq = pair.indexOf('=');
            String k = eq < 0 ? pair : pair.substring(0, eq);
            if (URLDecoder.decode(k, StandardCharsets.UTF_8).equals(name)) {
                return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    @Override public byte[] body() { return body; }
}
