package org.treqs.domain;

import org.treqs.api.interfaces.http.HttpRequest;
import org.treqs.domain.model.ControlHeaders;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pulls the control headers off a request and decides the action.
 * <p>
 * The three control header names are removed from the request, in any case and any
 * number of times, so the downstream handler never sees them. When a name repeats the
 * first value wins. A key whose bytes differ from the configured secret forces
 * {@link TraceAction#PASS_THROUGH}.
 * <p>
 * Header values are expected one char per wire byte (ISO-8859-1, as
 * {@link org.treqs.api.impl.HttpRequestReader} decodes them). The secret is compared
 * as its UTF-8 bytes.
 */
public final class RequestClassifier {
    private final byte[] secret;

    public RequestClassifier(String secretKey) {
        Objects.requireNonNull(secretKey, "secretKey");
        if (secretKey.isEmpty()) {
            // an empty secret would match requests that send no key at all
            throw new IllegalArgumentException("secret key must not be empty");
        }
        this.secret = secretKey.getBytes(StandardCharsets.UTF_8);
    }

    public ControlHeaders classify(HttpRequest req) {
        String key = null, action = null, id = null;
        List<String> matched = new ArrayList<>();

        for (String name : req.headerNames()) {
            if (name.equalsIgnoreCase(TreqsHeaders.KEY)) {
                if (key == null) key = req.header(name);
            } else if (name.equalsIgnoreCase(TreqsHeaders.ACTION)) {
                if (action == null) action = req.header(name);
            } else if (name.equalsIgnoreCase(TreqsHeaders.ID)) {
                if (id == null) id = req.header(name);
            } else {
                continue;
            }
            matched.add(name);
        }
        // removal happens after the scan
        for (String name : matched) {
            req.removeHeader(name);
        }

        key = key == null ? "" : key;
        id = id == null ? "" : id;
        TraceAction resolved = matchesSecret(key) ? TraceAction.fromHeader(action) : TraceAction.PASS_THROUGH;
        return new ControlHeaders(key, resolved, id);
    }

    private boolean matchesSecret(String key) {
        byte[] wire = new byte[key.length()];
        for (int i = 0; i < wire.length; i++) {
            char c = key.charAt(i);
            if (c > 0xFF) return false; // not a wire byte
            wire[i] = (byte) c;
        }
        return MessageDigest.isEqual(secret, wire);
    }
}
