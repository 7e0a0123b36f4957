package com.questrail.htl.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of StaticServerObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jStaticServerObservabilitySink implements StaticServerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jStaticServerObservabilitySink.class);

    @Override
    public void onRouteRegistered(RouteRegisteredEvent event) {
        log.info("Registered path: {} -> {}{}",
            event.route(),
            event.file(),
            event.reloading() ? " (reloading)" : "");
    }

    @Override
    public void onRequest(RequestServedEvent event) {
        log.debug("{} {} -> {} ({} bytes)",
            event.method(),
            event.path(),
            event.status(),
            event.contentLength());
    }

    @Override
    public void onError(ResourceErrorEvent event) {
        log.error("Cannot serve {}: {}", event.path(), event.message(), event.cause());
    }
}
