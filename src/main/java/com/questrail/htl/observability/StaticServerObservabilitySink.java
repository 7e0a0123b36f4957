package com.questrail.htl.observability;

/**
 * Main interface for receiving static server observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface StaticServerObservabilitySink {
    /**
     * Called once per route when the route table is built.
     * @param event the registration details
     */
    void onRouteRegistered(RouteRegisteredEvent event);

    /**
     * Called after a request has been answered.
     * @param event the request and its outcome
     */
    void onRequest(RequestServedEvent event);

    /**
     * Called when a resource could not be produced for a request.
     * @param event the error event
     */
    void onError(ResourceErrorEvent event);
}
