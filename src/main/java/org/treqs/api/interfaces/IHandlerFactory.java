package org.treqs.api.interfaces;

import org.treqs.api.interfaces.http.HttpRequest;

public interface IHandlerFactory {
    IHttpHandler create(HttpRequest req);

    /** Single handler that routes every request through {@link #create}. */
    default IHttpHandler asHandler() {
        return (req, res) -> create(req).handle(req, res);
    }
}
