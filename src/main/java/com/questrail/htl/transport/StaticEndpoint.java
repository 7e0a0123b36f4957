package com.questrail.htl.transport;

import java.net.InetSocketAddress;

/**
 * StaticEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for an HTTP transport serving static resources.
 *
 * <p>The endpoint only moves requests and responses. Route lookup, loading and
 * error reporting belong to the {@link StaticRequestListener}.</p>
 *
 * <p>Implementations may be backed by Netty or a test harness.</p>
 */
public interface StaticEndpoint
{
    /**
     * Bind the endpoint and begin accepting requests. Returns once the socket
     * is bound.
     *
     * @throws IllegalStateException if no listener is set or the bind fails
     */
    void start();

    /**
     * Stop accepting requests and release all transport resources.
     */
    void stop();

    /**
     * Block until the endpoint has been stopped.
     */
    void awaitTermination() throws InterruptedException;

    /**
     * The address actually bound; resolves an ephemeral port.
     *
     * @throws IllegalStateException if the endpoint is not started
     */
    InetSocketAddress localAddress();

    /**
     * Register the listener that answers requests.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(StaticRequestListener listener);
}
