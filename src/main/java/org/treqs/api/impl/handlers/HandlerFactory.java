package org.treqs.api.impl.handlers;

import org.treqs.api.interfaces.IHandlerFactory;
import org.treqs.api.interfaces.IHttpHandler;
import org.treqs.api.interfaces.http.HttpRequest;

import java.util.Locale;

/** Routes for the sample application that sits behind the tracing middleware. */
public class HandlerFactory implements IHandlerFactory {

    private final PiResultCache cache;
    public HandlerFactory(PiResultCache cache) { this.cache = cache; }

    @Override
    public IHttpHandler create(HttpRequest req) {
        String m = req.method().toUpperCase(Locale.ROOT);
        String p = req.path();
        int q = p.indexOf('?');
        if (q >= 0) p = p.substring(0, q);

        if (!"GET".equals(m)) return new NotFoundHandler();
        if ("/pi".equals(p) || "/".equals(p)) return new PiHandler(cache);
        if ("/health".equals(p)) return new HealthHandler(cache);

        return new NotFoundHandler();
    }
}
