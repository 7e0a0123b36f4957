package com.questrail.htl.runtime;

import com.questrail.htl.config.StaticServerConfig;
import com.questrail.htl.observability.NullObservabilitySink;
import com.questrail.htl.observability.RouteRegisteredEvent;
import com.questrail.htl.observability.StaticServerObservabilitySink;
import com.questrail.htl.resource.ReloadingResourceHandler;
import com.questrail.htl.resource.ResourceHandler;
import com.questrail.htl.resource.ResourceLoader;
import com.questrail.htl.resource.ResourceRoutes;
import com.questrail.htl.transport.StaticEndpoint;
import com.questrail.htl.transport.netty.NettyHttpStaticEndpoint;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * StaticServerRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the static server.
 *
 * <pre>
 *   StaticEndpoint (Netty HTTP)
 *        → RouteDispatcher
 *            → ResourceRoutes
 *                → ResourceHandler (cached or reloading)
 *                    → ResourceLoader (.htl → HTML)
 * </pre>
 *
 * <p>Building the runtime walks the configured directories. Outside dev mode
 * every file is loaded and transformed at that point, so a broken {@code .htl}
 * file fails the build rather than a later request.</p>
 */
public final class StaticServerRuntime {
    private final StaticEndpoint endpoint;
    private final ResourceRoutes routes;

    private StaticServerRuntime(StaticEndpoint endpoint, ResourceRoutes routes) {
        this.endpoint = endpoint;
        this.routes = routes;
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    public void awaitTermination() throws InterruptedException {
        endpoint.awaitTermination();
    }

    public InetSocketAddress localAddress() {
        return endpoint.localAddress();
    }

    public ResourceRoutes routes() {
        return routes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private StaticServerConfig config;
        private ResourceLoader loader;
        private StaticServerObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Function<InetSocketAddress, StaticEndpoint> endpointFactory = NettyHttpStaticEndpoint::new;

        public Builder withConfig(StaticServerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withLoader(ResourceLoader loader) {
            this.loader = loader;
            return this;
        }

        public Builder withObservabilitySink(StaticServerObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withEndpointFactory(Function<InetSocketAddress, StaticEndpoint> factory) {
            this.endpointFactory = factory;
            return this;
        }

        /**
         * @throws IOException if a directory cannot be walked, or, outside dev
         *         mode, a file cannot be loaded
         */
        public StaticServerRuntime build() throws IOException {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(endpointFactory, "endpointFactory");
            ResourceLoader effectiveLoader = (loader != null) ? loader : ResourceLoader.withDefaults();

            // 1. Routes; when the index page exists it answers "/" and every unmatched path
            ResourceRoutes routes = ResourceRoutes
                .fromDirectories(config.directories(), config.dev(), effectiveLoader)
                .withIndex(config.index());

            for (Map.Entry<String, ResourceHandler> route : routes.asMap().entrySet()) {
                ResourceHandler handler = route.getValue();
                observabilitySink.onRouteRegistered(new RouteRegisteredEvent(
                    route.getKey(),
                    handler.file(),
                    handler instanceof ReloadingResourceHandler));
            }

            // 2. Transport
            InetSocketAddress bindAddress = (config.host() == null)
                ? new InetSocketAddress(config.port())
                : new InetSocketAddress(config.host(), config.port());
            StaticEndpoint endpoint = endpointFactory.apply(bindAddress);
            endpoint.setListener(new RouteDispatcher(routes, observabilitySink));

            return new StaticServerRuntime(endpoint, routes);
        }
    }
}
