package org.treqs.api.impl.handlers;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import org.treqs.api.interfaces.IHttpHandler;
import org.treqs.api.interfaces.http.HttpRequest;
import org.treqs.api.interfaces.http.HttpResponse;

public class NotFoundHandler implements IHttpHandler {
    private static final Gson gson = new Gson();

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        JsonObject err = new JsonObject();
        err.addProperty("error", "no route for " + req.method() + " " + req.path());
        res.status(404, "Not Found");
        res.header("Content-Type", "application/json; charset=utf-8");
        res.body(gson.toJson(err));
    }
}
