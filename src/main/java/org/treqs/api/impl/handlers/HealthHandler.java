package org.treqs.api.impl.handlers;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import org.treqs.api.interfaces.IHttpHandler;
import org.treqs.api.interfaces.http.HttpRequest;
import org.treqs.api.interfaces.http.HttpResponse;

public class HealthHandler implements IHttpHandler {
    private static final Gson gson = new Gson();

    private final PiResultCache cache;
    public HealthHandler(PiResultCache cache) { this.cache = cache; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        JsonObject body = new JsonObject();
        body.addProperty("status", "ok");
        body.addProperty("cachedResults", cache.size());
        res.status(200, "OK");
        res.header("Content-Type", "application/json; charset=utf-8");
        res.body(gson.toJson(body));
    }
}
