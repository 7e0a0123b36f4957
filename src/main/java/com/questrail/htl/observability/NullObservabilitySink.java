package com.questrail.htl.observability;

/**
 * No-op implementation of StaticServerObservabilitySink.
 */
public final class NullObservabilitySink implements StaticServerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRouteRegistered(RouteRegisteredEvent event) {}

    @Override
    public void onRequest(RequestServedEvent event) {}

    @Override
    public void onError(ResourceErrorEvent event) {}
}
