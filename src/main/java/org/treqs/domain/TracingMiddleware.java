package org.treqs.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treqs.api.interfaces.IHttpHandler;
import org.treqs.api.interfaces.http.HttpRequest;
import org.treqs.api.interfaces.http.HttpResponse;
import org.treqs.domain.model.ControlHeaders;

/**
 * Entry point for every request: classify, strip control headers, dispatch.
 *
 * <pre>
 *   IHttpHandler app = ...;
 *   TraceCoordinator coordinator = new TraceCoordinator(app, new JfrTraceCapture(),
 *           new SecureRandomSessionIds(), new InMemorySessionStore());
 *   IHttpHandler handler = new TracingMiddleware(new RequestClassifier("secret"), coordinator);
 * </pre>
 */
public final class TracingMiddleware implements IHttpHandler {
    private static final Logger LOG = LoggerFactory.getLogger(TracingMiddleware.class);

    private final RequestClassifier classifier;
    private final TraceCoordinator coordinator;

    public TracingMiddleware(RequestClassifier classifier, TraceCoordinator coordinator) {
        this.classifier = classifier;
        this.coordinator = coordinator;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) throws Exception {
        ControlHeaders control = classifier.classify(req);
        if (control.action() != TraceAction.PASS_THROUGH) {
            LOG.debug("{} {} -> {}", req.method(), req.path(), control.action());
        }

        switch (control.action()) {
            case TRACE -> coordinator.trace(req, res);
            case READ -> coordinator.read(control.id(), res);
            case RESET -> coordinator.reset(res);
            default -> coordinator.passThrough(req, res);
        }
    }
}
