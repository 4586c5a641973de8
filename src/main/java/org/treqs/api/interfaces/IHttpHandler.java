package org.treqs.api.interfaces;

import org.treqs.api.interfaces.http.HttpRequest;
import org.treqs.api.interfaces.http.HttpResponse;

public interface IHttpHandler {
    void handle(HttpRequest req, HttpResponse res) throws Exception;
}
