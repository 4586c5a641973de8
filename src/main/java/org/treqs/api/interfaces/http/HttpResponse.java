package org.treqs.api.interfaces.http;

/** Minimal response contract */
public interface HttpResponse {
    void status(int code, String reason);
    void header(String name, String value);
    void removeHeader(String name);
    void body(String text);
    void body(byte[] bytes);
}
