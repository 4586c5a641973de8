package org.treqs.client;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One-shot HTTP/1.1 exchanges over a plain socket ({@code Connection: close}).
 * Bodies are kept as bytes so binary trace data survives.
 */
public class RawHttpClient {

    private final int timeoutMs;

    public RawHttpClient(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    /**
     * Builds a raw HTTP/1.1 request head.
     *
     * @param extraHeaders additional headers, may be null
     */
    public String buildRequest(String method, String path, String host, int port,
                               Map<String, String> extraHeaders, int contentLength) {
        StringBuilder sb = new StringBuilder();
        sb.append(method).append(" ").append(path).append(" HTTP/1.1\r\n");
        sb.append("Host: ").append(host).append(":").append(port).append("\r\n");
        if (extraHeaders != null) {
            for (Map.Entry<String, String> e : extraHeaders.entrySet()) {
                sb.append(e.getKey()).append(": ").append(e.getValue()).append("\r\n");
            }
        }
        sb.append("Connection: close\r\n");
        sb.append("Content-Length: ").append(contentLength).append("\r\n\r\n");
        return sb.toString();
    }

    public RawResponse exchange(String method, String host, int port, String path,
                                Map<String, String> headers) throws IOException {
        String head = buildRequest(method, path, host, port, headers, 0);
        try (Socket socket = new Socket(host, port);
             OutputStream out = socket.getOutputStream();
             InputStream in = socket.getInputStream()) {
            socket.setSoTimeout(timeoutMs);
            // a non-ASCII key goes out as its UTF-8 bytes
            out.write(head.getBytes(StandardCharsets.UTF_8));
            out.flush();
            return parse(in.readAllBytes());
        }
    }

    static RawResponse parse(byte[] raw) throws IOException {
        int split = indexOf(raw, new byte[]{'\r', '\n', '\r', '\n'});
        if (split < 0) {
            throw new IOException("malformed HTTP response: no header terminator in " + raw.length + " bytes");
        }
        String head = new String(raw, 0, split, StandardCharsets.ISO_8859_1);
        String[] lines = head.split("\r\n");

        String[] statusLine = lines[0].split(" ", 3);
        if (statusLine.length < 2) {
            throw new IOException("malformed status line: " + lines[0]);
        }
        int status;
        try {
            status = Integer.parseInt(statusLine[1]);
        } catch (NumberFormatException e) {
            throw new IOException("malformed status line: " + lines[0], e);
        }
        String reason = statusLine.length > 2 ? statusLine[2] : "";

        List<Map.Entry<String, String>> headers = new ArrayList<>();
        for (int i = 1; i < lines.length; i++) {
            int idx = lines[i].indexOf(':');
            if (idx > 0) {
                headers.add(new AbstractMap.SimpleImmutableEntry<>(
                        lines[i].substring(0, idx).trim(), lines[i].substring(idx + 1).trim()));
            }
        }

        int from = split + 4;
        byte[] body = new byte[raw.length - from];
        System.arraycopy(raw, from, body, 0, body.length);
        return new RawResponse(status, reason, headers, body);
    }

    private static int indexOf(byte[] data, byte[] pattern) {
        outer:
        for (int i = 0; i <= data.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) continue outer;
            }
            return i;
        }
        return -1;
    }
}
