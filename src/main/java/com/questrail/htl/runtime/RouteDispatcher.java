package com.questrail.htl.runtime;

import com.questrail.htl.observability.RequestServedEvent;
import com.questrail.htl.observability.ResourceErrorEvent;
import com.questrail.htl.observability.StaticServerObservabilitySink;
import com.questrail.htl.resource.Resource;
import com.questrail.htl.resource.ResourceHandler;
import com.questrail.htl.resource.ResourceRoutes;
import com.questrail.htl.transport.StaticRequestListener;
import com.questrail.htl.transport.StaticResponse;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * RouteDispatcher
 * =============================================================================
 * Answers transport requests from a {@link ResourceRoutes} table.
 *
 * <ul>
 *   <li>GET or HEAD on a known route: 200 with the resource</li>
 *   <li>unknown route: the index fallback when the routes carry one, else 404</li>
 *   <li>any other method: 405</li>
 *   <li>resource failure (dev mode only, cached resources cannot fail): 500
 *       with no body, reported to the sink</li>
 * </ul>
 *
 * <p>A failing resource never takes the server down; the next request for the
 * same path tries again.</p>
 */
public final class RouteDispatcher implements StaticRequestListener {
    private final ResourceRoutes routes;
    private final StaticServerObservabilitySink sink;

    public RouteDispatcher(ResourceRoutes routes, StaticServerObservabilitySink sink) {
        this.routes = Objects.requireNonNull(routes, "routes");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public StaticResponse onRequest(String method, String path) {
        StaticResponse response = dispatch(method, path);
        sink.onRequest(new RequestServedEvent(Instant.now(), method, path, response.status(), response.body().length));
        return response;
    }

    private StaticResponse dispatch(String method, String path) {
        if (!"GET".equals(method) && !"HEAD".equals(method)) {
            return StaticResponse.empty(405);
        }

        Optional<ResourceHandler> handler = routes.lookup(path);
        if (handler.isEmpty()) {
            return StaticResponse.empty(404);
        }

        try {
            Resource resource = handler.get().resource();
            return StaticResponse.ok(resource.contentType(), resource.content());
        } catch (IOException e) {
            sink.onError(new ResourceErrorEvent(Instant.now(), path, e.getMessage(), e));
            return StaticResponse.empty(500);
        }
    }
}
