package org.treqs.api.impl;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses one HTTP/1.1 request off a connection.
 * <p>
 * The request line and headers are decoded as ISO-8859-1, so every char of a header
 * value stands for exactly one byte on the wire.
 */
public final class HttpRequestReader {
    public static final int MAX_BODY_BYTES = 8 * 1024 * 1024;

    private HttpRequestReader() {}

    /**
     * @return the parsed request, or null when the request line is missing
     * @throws RequestTooLargeException when the declared body exceeds {@link #MAX_BODY_BYTES}
     * @throws IOException on socket failure
     */
    public static MinimalHttpRequest read(BufferedInputStream in, OutputStream out) throws IOException {
        String start = readLine(in); // e.g. "GET /pi?rounds=100 HTTP/1.1"
        if (start == null || start.isEmpty()) {
            return null;
        }
        String[] p = start.split(" ", 3);
        String method = p.length > 0 ? p[0] : "";
        String path   = p.length > 1 ? p[1] : "/";
        String ver    = p.length > 2 ? p[2] : "HTTP/1.1";

        List<Map.Entry<String, String>> headers = new ArrayList<>();
        String line;
        while ((line = readLine(in)) != null && !line.isEmpty()) {
            int idx = line.indexOf(':');
            if (idx > 0) {
                headers.add(new AbstractMap.SimpleImmutableEntry<>(
                        line.substring(0, idx).trim(), line.substring(idx + 1).trim()));
            }
        }

        String expect = first(headers, "Expect");
        if (expect != null && expect.equalsIgnoreCase("100-continue")) {
            OutputStreamWriter w100 = new OutputStreamWriter(out, StandardCharsets.US_ASCII);
            w100.write("HTTP/1.1 100 Continue\r\n\r\n");
            w100.flush();
        }

        long declared = 0;
        try {
            String cl = first(headers, "Content-Length");
            if (cl != null) declared = Math.max(0, Long.parseLong(cl));
        } catch (NumberFormatException e) {
            declared = 0;
        }
        if (declared > MAX_BODY_BYTES) {
            throw new RequestTooLargeException(declared, MAX_BODY_BYTES);
        }
        int len = (int) declared;
        byte[] body = new byte[len];
        int total = 0;
        while (total < len) {
            int n = in.read(body, total, len - total);
            if (n < 0) break;
            total += n;
        }
        if (total < len) {
            byte[] shorter = new byte[total];
            System.arraycopy(body, 0, shorter, 0, total);
            body = shorter;
        }
        return new MinimalHttpRequest(method, path, ver, headers, body);
    }

    private static String first(List<Map.Entry<String, String>> headers, String name) {
        for (Map.Entry<String, String> e : headers) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    static String readLine(BufferedInputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int prev = -1, b;
        while ((b = in.read()) != -1) {
            if (prev == '\r' && b == '\n') {
                byte[] bytes = buf.toByteArray();
                int len = Math.max(0, bytes.length - 1);
                return new String(bytes, 0, len, StandardCharsets.ISO_8859_1);
            }
            buf.write(b);
            prev = b;
        }
        return (buf.size() == 0) ? null : buf.toString(StandardCharsets.ISO_8859_1);
    }
}
